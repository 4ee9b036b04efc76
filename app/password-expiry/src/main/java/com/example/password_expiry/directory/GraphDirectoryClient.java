/*
 * どこで: Password expiry ディレクトリ連携
 * 何を: Microsoft Graph からユーザー/グループメンバー/上長を取得する
 * なぜ: client credentials で得たトークンを 1 ジョブ内で再利用し、ページングと失敗分類を 1 箇所に閉じ込めるため
 */
package com.example.password_expiry.directory;

import com.example.password_expiry.config.DirectoryClientProperties;
import com.example.password_expiry.directory.dto.GraphGroup;
import com.example.password_expiry.directory.dto.GraphGroupPage;
import com.example.password_expiry.directory.dto.GraphManager;
import com.example.password_expiry.directory.dto.GraphTokenResponse;
import com.example.password_expiry.directory.dto.GraphUser;
import com.example.password_expiry.directory.dto.GraphUserPage;
import com.example.password_expiry.model.DirectoryUser;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

public class GraphDirectoryClient implements DirectoryClient {

  static final String USER_SELECT =
      "id,displayName,userPrincipalName,accountEnabled,passwordPolicies,"
          + "lastPasswordChangeDateTime,createdDateTime,onPremisesSyncEnabled";

  private static final Logger logger = LoggerFactory.getLogger(GraphDirectoryClient.class);

  private final RestClient restClient;
  private final DirectoryClientProperties properties;
  private final String tenantId;
  private final String clientId;
  private final String clientSecret;
  private String accessToken;

  public GraphDirectoryClient(
      RestClient restClient,
      DirectoryClientProperties properties,
      String tenantId,
      String clientId,
      String clientSecret) {
    this.restClient = restClient;
    this.properties = properties;
    this.tenantId = tenantId;
    this.clientId = clientId;
    this.clientSecret = clientSecret;
  }

  @Override
  public List<DirectoryUser> listUsers() {
    final String token = accessToken();
    final GraphUserPage first =
        call(
            "list users",
            () ->
                restClient
                    .get()
                    .uri(
                        properties.graphBaseUrl() + "/users?$select={select}&$top={top}",
                        USER_SELECT,
                        properties.pageSize())
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(GraphUserPage.class));
    final List<DirectoryUser> users = collectPages(first, token, "list users");
    logger.info("directory users loaded count={}", users.size());
    return users;
  }

  @Override
  public List<DirectoryUser> listGroupMembers(String groupName) {
    if (groupName == null || groupName.isBlank()) {
      throw new IllegalArgumentException("groupName is required");
    }
    final String token = accessToken();
    final String groupId = resolveGroupId(groupName, token);
    final GraphUserPage first =
        call(
            "list group members",
            () ->
                restClient
                    .get()
                    .uri(
                        properties.graphBaseUrl()
                            + "/groups/{id}/transitiveMembers/microsoft.graph.user"
                            + "?$select={select}&$top={top}",
                        groupId,
                        USER_SELECT,
                        properties.pageSize())
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(GraphUserPage.class));
    final List<DirectoryUser> members = collectPages(first, token, "list group members");
    logger.info(
        "directory group members loaded group={} groupId={} count={}",
        groupName,
        groupId,
        members.size());
    return members;
  }

  @Override
  public Optional<String> findManagerAddress(String userId) {
    final String token = accessToken();
    final GraphManager manager;
    try {
      manager =
          call(
              "get manager",
              () ->
                  restClient
                      .get()
                      .uri(
                          properties.graphBaseUrl()
                              + "/users/{id}/manager?$select=id,mail,userPrincipalName",
                          userId)
                      .headers(headers -> headers.setBearerAuth(token))
                      .retrieve()
                      .body(GraphManager.class));
    } catch (DirectoryIntegrationException ex) {
      if (ex.reason() == DirectoryIntegrationException.Reason.NOT_FOUND) {
        return Optional.empty();
      }
      throw ex;
    }
    if (!isBlank(manager.mail())) {
      return Optional.of(manager.mail());
    }
    return isBlank(manager.userPrincipalName())
        ? Optional.empty()
        : Optional.of(manager.userPrincipalName());
  }

  @Override
  public PermissionCheck verifyAccess() {
    final String token;
    try {
      token = accessToken();
    } catch (DirectoryIntegrationException ex) {
      return new PermissionCheck(false, false, false, "Authentication failed: " + ex.getMessage());
    }
    final List<String> problems = new ArrayList<>();
    final boolean canReadUsers = probe("/users?$top=1&$select=id", token, "User.Read.All", problems);
    final boolean canReadGroups =
        probe("/groups?$top=1&$select=id", token, "Group.Read.All", problems);
    final String message =
        problems.isEmpty()
            ? "Authenticated and able to read users and groups"
            : String.join("; ", problems);
    return new PermissionCheck(true, canReadUsers, canReadGroups, message);
  }

  private boolean probe(String path, String token, String permission, List<String> problems) {
    try {
      call(
          "probe " + permission,
          () ->
              restClient
                  .get()
                  .uri(URI.create(properties.graphBaseUrl() + path))
                  .headers(headers -> headers.setBearerAuth(token))
                  .retrieve()
                  .toBodilessEntity());
      return true;
    } catch (DirectoryIntegrationException ex) {
      problems.add(permission + " check failed: " + ex.getMessage());
      return false;
    }
  }

  private String resolveGroupId(String groupName, String token) {
    final String filter = "displayName eq '" + groupName.trim().replace("'", "''") + "'";
    final GraphGroupPage page =
        call(
            "find group",
            () ->
                restClient
                    .get()
                    .uri(
                        properties.graphBaseUrl() + "/groups?$filter={filter}&$select=id,displayName",
                        filter)
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(GraphGroupPage.class));
    final List<GraphGroup> groups = page.value() == null ? List.of() : page.value();
    return groups.stream()
        .map(GraphGroup::id)
        .filter(id -> !isBlank(id))
        .findFirst()
        .orElseThrow(
            () ->
                new DirectoryIntegrationException(
                    DirectoryIntegrationException.Reason.NOT_FOUND,
                    "directory group not found: " + groupName));
  }

  private List<DirectoryUser> collectPages(GraphUserPage first, String token, String operation) {
    final List<DirectoryUser> users = new ArrayList<>();
    GraphUserPage page = first;
    while (true) {
      if (page.value() != null) {
        for (GraphUser user : page.value()) {
          users.add(toDirectoryUser(user));
        }
      }
      final String nextLink = page.nextLink();
      if (isBlank(nextLink)) {
        return users;
      }
      // nextLink はエンコード済みの絶対 URL なので再テンプレート化しない
      page =
          call(
              operation,
              () ->
                  restClient
                      .get()
                      .uri(URI.create(nextLink))
                      .headers(headers -> headers.setBearerAuth(token))
                      .retrieve()
                      .body(GraphUserPage.class));
    }
  }

  private String accessToken() {
    if (accessToken != null) {
      return accessToken;
    }
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("client_id", clientId);
    form.add("client_secret", clientSecret);
    form.add("scope", properties.scope());
    form.add("grant_type", "client_credentials");
    final GraphTokenResponse response;
    try {
      response =
          call(
              "acquire token",
              () ->
                  restClient
                      .post()
                      .uri(properties.loginBaseUrl() + "/{tenantId}/oauth2/v2.0/token", tenantId)
                      .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                      .body(form)
                      .retrieve()
                      .body(GraphTokenResponse.class));
    } catch (DirectoryIntegrationException ex) {
      // token endpoint は資格情報不正を 400/401 で返す
      if (ex.reason() == DirectoryIntegrationException.Reason.BAD_GATEWAY
          || ex.reason() == DirectoryIntegrationException.Reason.TIMEOUT
          || ex.reason() == DirectoryIntegrationException.Reason.INVALID_RESPONSE) {
        throw ex;
      }
      throw new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.UNAUTHORIZED,
          "directory authentication failed",
          ex);
    }
    if (isBlank(response.accessToken())) {
      throw new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.INVALID_RESPONSE, "token response has no access_token");
    }
    accessToken = response.accessToken();
    return accessToken;
  }

  private <T> T call(String operation, Supplier<T> request) {
    try {
      final T body = request.get();
      if (body == null) {
        throw new DirectoryIntegrationException(
            DirectoryIntegrationException.Reason.INVALID_RESPONSE,
            "directory " + operation + " returned an empty body");
      }
      return body;
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, operation);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, operation);
    } catch (DirectoryIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.INVALID_RESPONSE,
          "directory " + operation + " response parse failed",
          ex);
    }
  }

  private DirectoryIntegrationException mapResponseException(
      RestClientResponseException ex, String operation) {
    final int status = ex.getStatusCode().value();
    if (status == 401) {
      return new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.UNAUTHORIZED,
          "directory rejected credentials during " + operation,
          ex);
    }
    if (status == 403) {
      return new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.FORBIDDEN,
          "directory denied " + operation + " (missing application permission)",
          ex);
    }
    if (status == 404) {
      return new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.NOT_FOUND,
          "directory resource not found during " + operation,
          ex);
    }
    if (ex.getStatusCode().is4xxClientError()) {
      return new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.UNAUTHORIZED,
          "directory rejected " + operation + " status=" + status,
          ex);
    }
    return new DirectoryIntegrationException(
        DirectoryIntegrationException.Reason.BAD_GATEWAY,
        "directory server error during " + operation + " status=" + status,
        ex);
  }

  private DirectoryIntegrationException mapResourceException(
      ResourceAccessException ex, String operation) {
    if (isTimeout(ex)) {
      return new DirectoryIntegrationException(
          DirectoryIntegrationException.Reason.TIMEOUT,
          "directory " + operation + " timed out",
          ex);
    }
    return new DirectoryIntegrationException(
        DirectoryIntegrationException.Reason.BAD_GATEWAY,
        "directory connection failed during " + operation,
        ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  private DirectoryUser toDirectoryUser(GraphUser user) {
    return new DirectoryUser(
        user.id(),
        user.displayName(),
        user.userPrincipalName(),
        Boolean.TRUE.equals(user.accountEnabled()),
        user.lastPasswordChangeDateTime(),
        user.createdDateTime(),
        Boolean.TRUE.equals(user.onPremisesSyncEnabled()),
        user.passwordPolicies());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
