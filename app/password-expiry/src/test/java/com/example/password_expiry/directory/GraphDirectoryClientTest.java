package com.example.password_expiry.directory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.password_expiry.config.DirectoryClientProperties;
import com.example.password_expiry.model.DirectoryUser;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class GraphDirectoryClientTest {

  private static final String GRAPH = "http://graph.test/v1.0";
  private static final String TOKEN_URL = "http://login.test/tenant-1/oauth2/v2.0/token";
  private static final String TOKEN_JSON =
      """
      {"token_type":"Bearer","expires_in":3599,"access_token":"token-x"}
      """;

  @Test
  void listUsersFollowsNextLinkAndReusesToken() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users?$select=")))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer token-x"))
        .andRespond(
            withSuccess(
                """
                {"value":[{"id":"u-1","displayName":"Alice","userPrincipalName":"alice@example.com",
                "accountEnabled":true,"lastPasswordChangeDateTime":"2024-01-01T00:00:00Z"}],
                "@odata.nextLink":"http://graph.test/v1.0/users?$skiptoken=page2"}
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(GRAPH + "/users?$skiptoken=page2"))
        .andExpect(header("Authorization", "Bearer token-x"))
        .andRespond(
            withSuccess(
                """
                {"value":[{"id":"u-2","displayName":"Bob","userPrincipalName":"bob@example.com",
                "accountEnabled":false,"passwordPolicies":"DisablePasswordExpiration"}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<DirectoryUser> users = fixture.client.listUsers();

    assertThat(users).extracting(DirectoryUser::id).containsExactly("u-1", "u-2");
    assertThat(users.get(0).lastPasswordChangeAt())
        .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(users.get(1).accountEnabled()).isFalse();
    assertThat(users.get(1).passwordPolicies()).isEqualTo("DisablePasswordExpiration");
    fixture.server.verify();
  }

  @Test
  void listGroupMembersResolvesGroupIdFirst() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/groups?$filter=")))
        .andExpect(requestTo(containsString("Finance")))
        .andRespond(
            withSuccess(
                """
                {"value":[{"id":"g-1","displayName":"Finance"}]}
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(
            requestTo(
                startsWith(GRAPH + "/groups/g-1/transitiveMembers/microsoft.graph.user")))
        .andRespond(
            withSuccess(
                """
                {"value":[{"id":"u-3","userPrincipalName":"carol@example.com",
                "accountEnabled":true,"unknownField":1}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<DirectoryUser> members = fixture.client.listGroupMembers("Finance");

    assertThat(members)
        .extracting(DirectoryUser::principalName)
        .containsExactly("carol@example.com");
    fixture.server.verify();
  }

  @Test
  void unknownGroupIsNotFound() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/groups?$filter=")))
        .andRespond(withSuccess("{\"value\":[]}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.listGroupMembers("Nobody"))
        .isInstanceOf(DirectoryIntegrationException.class)
        .hasMessageContaining("Nobody")
        .extracting(ex -> ((DirectoryIntegrationException) ex).reason())
        .isEqualTo(DirectoryIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void managerAddressPrefersMailAndFallsBackToPrincipalName() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users/u-1/manager")))
        .andRespond(
            withSuccess(
                "{\"id\":\"m-1\",\"mail\":\"boss@example.com\"}", MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users/u-2/manager")))
        .andRespond(
            withSuccess(
                "{\"id\":\"m-2\",\"mail\":null,\"userPrincipalName\":\"lead@example.com\"}",
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users/u-3/manager")))
        .andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertThat(fixture.client.findManagerAddress("u-1")).contains("boss@example.com");
    assertThat(fixture.client.findManagerAddress("u-2")).contains("lead@example.com");
    assertThat(fixture.client.findManagerAddress("u-3")).isEmpty();
    fixture.server.verify();
  }

  @Test
  void rejectedTokenRequestIsUnauthorized() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_client\"}"));

    assertThatThrownBy(() -> fixture.client.listUsers())
        .isInstanceOf(DirectoryIntegrationException.class)
        .extracting(ex -> ((DirectoryIntegrationException) ex).reason())
        .isEqualTo(DirectoryIntegrationException.Reason.UNAUTHORIZED);
  }

  @Test
  void forbiddenIsMappedToForbidden() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users?$select=")))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    assertThatThrownBy(() -> fixture.client.listUsers())
        .isInstanceOf(DirectoryIntegrationException.class)
        .extracting(ex -> ((DirectoryIntegrationException) ex).reason())
        .isEqualTo(DirectoryIntegrationException.Reason.FORBIDDEN);
  }

  @Test
  void serverErrorIsMappedToBadGateway() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users?$select=")))
        .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

    assertThatThrownBy(() -> fixture.client.listUsers())
        .isInstanceOf(DirectoryIntegrationException.class)
        .extracting(ex -> ((DirectoryIntegrationException) ex).reason())
        .isEqualTo(DirectoryIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void timeoutIsMappedToTimeout() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(startsWith(GRAPH + "/users?$select=")))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.listUsers())
        .isInstanceOf(DirectoryIntegrationException.class)
        .extracting(ex -> ((DirectoryIntegrationException) ex).reason())
        .isEqualTo(DirectoryIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void verifyAccessReportsMissingGroupPermission() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(GRAPH + "/users?$top=1&$select=id"))
        .andRespond(withSuccess("{\"value\":[]}", MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(GRAPH + "/groups?$top=1&$select=id"))
        .andRespond(withStatus(HttpStatus.FORBIDDEN));

    final PermissionCheck check = fixture.client.verifyAccess();

    assertThat(check.authenticated()).isTrue();
    assertThat(check.canReadUsers()).isTrue();
    assertThat(check.canReadGroups()).isFalse();
    assertThat(check.success()).isFalse();
    assertThat(check.message()).contains("Group.Read.All");
  }

  @Test
  void verifyAccessReportsAuthenticationFailure() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    final PermissionCheck check = fixture.client.verifyAccess();

    assertThat(check.authenticated()).isFalse();
    assertThat(check.success()).isFalse();
    assertThat(check.message()).startsWith("Authentication failed");
  }

  private void expectToken(ClientFixture fixture) {
    fixture
        .server
        .expect(once(), requestTo(TOKEN_URL))
        .andExpect(method(POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(content().formDataContains(Map.of("grant_type", "client_credentials")))
        .andRespond(withSuccess(TOKEN_JSON, MediaType.APPLICATION_JSON));
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final DirectoryClientProperties properties =
        new DirectoryClientProperties(
            GRAPH,
            "http://login.test",
            null,
            100,
            Duration.ofSeconds(1),
            Duration.ofSeconds(1));
    final GraphDirectoryClient client =
        new GraphDirectoryClient(
            builder.build(), properties, "tenant-1", "client-1", "secret-1");
    return new ClientFixture(server, client);
  }

  private record ClientFixture(MockRestServiceServer server, GraphDirectoryClient client) {}
}
