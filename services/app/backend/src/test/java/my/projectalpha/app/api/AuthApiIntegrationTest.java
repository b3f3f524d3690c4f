package my.projectalpha.app.api;

import com.jayway.jsonpath.JsonPath;
import my.projectalpha.app.support.TestDatabaseCleaner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.httpBasic;
import static org.springframework.security.test.web.servlet.setup.SecurityMockMvcConfigurers.springSecurity;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = my.projectalpha.app.AppApplication.class)
@ActiveProfiles("test")
class AuthApiIntegrationTest {
	private static final String JWT_SECRET = "0123456789abcdef0123456789abcdef";

	@Autowired
	private WebApplicationContext context;

	@Autowired
	private TestDatabaseCleaner databaseCleaner;

	private MockMvc mockMvc;

	@DynamicPropertySource
	static void registerProperties(DynamicPropertyRegistry registry) {
		registry.add("app.security.admin-user", () -> "admin");
		registry.add("app.security.admin-pass", () -> "admin");
		registry.add("app.jwt.secret", () -> JWT_SECRET);
		registry.add("app.jwt.issuer", () -> "test-issuer");
		registry.add("app.jwt.ttl-seconds", () -> "900");
	}

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.webAppContextSetup(context).apply(springSecurity()).build();
	}

	@AfterEach
	void tearDown() {
		databaseCleaner.clean();
	}

	@Test
	void tokenEndpointReturnsJwt() throws Exception {
		String body = "{\"username\":\"admin\",\"password\":\"admin\"}";

		mockMvc.perform(post("/auth/token")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.token").isNotEmpty())
				.andExpect(jsonPath("$.tokenType").value("Bearer"))
				.andExpect(jsonPath("$.expiresIn").value(900));
	}

	@Test
	void tokenEndpointRejectsInvalidCredentials() throws Exception {
		String body = "{\"username\":\"admin\",\"password\":\"bad\"}";

		mockMvc.perform(post("/auth/token")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isBadRequest());
	}

	@Test
	void jwtTokenAllowsAccessToProtectedApi() throws Exception {
		String body = "{\"username\":\"admin\",\"password\":\"admin\"}";

		String tokenResponse = mockMvc.perform(post("/api/auth/token")
						.contentType(MediaType.APPLICATION_JSON)
						.content(body))
				.andExpect(status().isOk())
				.andReturn()
				.getResponse()
				.getContentAsString();

		String token = JsonPath.read(tokenResponse, "$.token");

		mockMvc.perform(get("/api/sellers")
						.header("Authorization", "Bearer " + token))
				.andExpect(status().isOk());
	}

	@Test
	void jwtTokenCarriesAdminRole() throws Exception {
		String tokenResponse = mockMvc.perform(post("/api/auth/token")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"username\":\"admin\",\"password\":\"admin\"}"))
				.andReturn()
				.getResponse()
				.getContentAsString();
		String token = JsonPath.read(tokenResponse, "$.token");

		mockMvc.perform(multipart("/api/am/imports/servicer-data")
						.file(new MockMultipartFile("file", "empty.csv", "text/csv", new byte[0]))
						.header("Authorization", "Bearer " + token))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("File is empty"));
	}

	@Test
	void swaggerUiEntryPointIsOpenToAuthenticatedUsers() throws Exception {
		mockMvc.perform(get("/swagger-ui.html").with(httpBasic("admin", "admin")))
				.andExpect(result -> assertThat(result.getResponse().getStatus()).isNotIn(401, 403));
	}

	@Test
	void protectedApiRequiresAuthentication() throws Exception {
		mockMvc.perform(get("/api/sellers"))
				.andExpect(status().isUnauthorized());
		mockMvc.perform(get("/api/sellers")
						.header("Authorization", "Bearer not-a-token"))
				.andExpect(status().isUnauthorized());
	}

	@Test
	void logoutEndpointReturnsUnauthorizedChallenge() throws Exception {
		mockMvc.perform(get("/auth/logout"))
				.andExpect(status().isUnauthorized())
				.andExpect(header().string("WWW-Authenticate", containsString("Basic realm=\"Project Alpha (Logged out)\"")));
	}
}
