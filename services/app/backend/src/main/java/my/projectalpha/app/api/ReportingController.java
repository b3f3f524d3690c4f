package my.projectalpha.app.api;

import my.projectalpha.app.dto.ChartPointDto;
import my.projectalpha.app.dto.OptionDto;
import my.projectalpha.app.dto.ReportingSummaryDto;
import my.projectalpha.app.dto.SellerOptionDto;
import my.projectalpha.app.dto.StatusReportRowDto;
import my.projectalpha.app.dto.TradeDrilldownDto;
import my.projectalpha.app.dto.TradeOptionDto;
import my.projectalpha.app.dto.TradeReportRowDto;
import my.projectalpha.app.reporting.ReportingFilter;
import my.projectalpha.app.service.ReportingService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/reporting")
public class ReportingController {
	private final ReportingService reportingService;

	public ReportingController(ReportingService reportingService) {
		this.reportingService = reportingService;
	}

	@GetMapping("/summary")
	public ReportingSummaryDto summary(@RequestParam(required = false) String tradeIds,
									   @RequestParam(required = false) String statuses,
									   @RequestParam(required = false) String startDate,
									   @RequestParam(required = false) String endDate) {
		return reportingService.summary(ReportingFilter.parse(tradeIds, statuses, startDate, endDate));
	}

	@GetMapping("/by-trade")
	public List<ChartPointDto> byTradeChart(@RequestParam(required = false) String tradeIds,
											@RequestParam(required = false) String statuses,
											@RequestParam(required = false) String startDate,
											@RequestParam(required = false) String endDate) {
		return reportingService.byTradeChart(ReportingFilter.parse(tradeIds, statuses, startDate, endDate));
	}

	@GetMapping("/by-trade/grid")
	public List<TradeReportRowDto> byTradeGrid(@RequestParam(required = false) String tradeIds,
											   @RequestParam(required = false) String statuses,
											   @RequestParam(required = false) String startDate,
											   @RequestParam(required = false) String endDate) {
		return reportingService.byTrade(ReportingFilter.parse(tradeIds, statuses, startDate, endDate));
	}

	@GetMapping("/by-status")
	public List<ChartPointDto> byStatusChart(@RequestParam(required = false) String tradeIds,
											 @RequestParam(required = false) String statuses,
											 @RequestParam(required = false) String startDate,
											 @RequestParam(required = false) String endDate) {
		return reportingService.byStatusChart(ReportingFilter.parse(tradeIds, statuses, startDate, endDate));
	}

	@GetMapping("/by-status/grid")
	public List<StatusReportRowDto> byStatusGrid(@RequestParam(required = false) String tradeIds,
												 @RequestParam(required = false) String statuses,
												 @RequestParam(required = false) String startDate,
												 @RequestParam(required = false) String endDate) {
		return reportingService.byStatus(ReportingFilter.parse(tradeIds, statuses, startDate, endDate));
	}

	@GetMapping("/trades/{tradeId}")
	public TradeDrilldownDto trade(@PathVariable Long tradeId) {
		return reportingService.tradeDrilldown(tradeId);
	}

	@GetMapping("/options/trades")
	public List<TradeOptionDto> tradeOptions() {
		return reportingService.tradeOptions();
	}

	@GetMapping("/options/statuses")
	public List<OptionDto> statusOptions() {
		return reportingService.statusOptions();
	}

	@GetMapping("/options/sellers")
	public List<SellerOptionDto> sellerOptions() {
		return reportingService.sellerOptions();
	}
}
