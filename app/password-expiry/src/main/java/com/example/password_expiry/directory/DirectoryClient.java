/*
 * どこで: Password expiry ディレクトリ連携
 * 何を: ユーザー/グループ/上長の読み取りと権限確認の境界
 * なぜ: ジョブを外部ディレクトリ API から切り離してテストできるようにするため
 */
package com.example.password_expiry.directory;

import com.example.password_expiry.model.DirectoryUser;
import java.util.List;
import java.util.Optional;

public interface DirectoryClient {

  /** Every user in the tenant, following pagination to the end. */
  List<DirectoryUser> listUsers();

  /**
   * Users that are direct or nested members of the group with the given display name.
   *
   * @throws DirectoryIntegrationException with {@code NOT_FOUND} when no such group exists
   */
  List<DirectoryUser> listGroupMembers(String groupName);

  /** Mail address of the user's manager, empty when none is assigned. */
  Optional<String> findManagerAddress(String userId);

  PermissionCheck verifyAccess();
}
