package my.projectalpha.app;

import my.projectalpha.app.llm.ValuationVisionClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class AppApplicationTests {

	private static final String JWT_SECRET = UUID.randomUUID().toString();

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@Autowired
	private ValuationVisionClient visionClient;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
	}

	@Test
	void contextLoads() {
		Integer tables = jdbcTemplate.queryForObject(
				"select count(*) from information_schema.tables where table_name = 'seller_raw_data'", Integer.class);
		assertThat(tables).isEqualTo(1);
		assertThat(visionClient.model()).isEqualTo("noop");
	}
}
