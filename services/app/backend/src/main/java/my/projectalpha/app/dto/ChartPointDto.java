package my.projectalpha.app.dto;

import java.math.BigDecimal;
import java.util.Map;

public record ChartPointDto(String x, BigDecimal y, Map<String, Object> meta) {
}
