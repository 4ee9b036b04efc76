/*
 * どこで: Password expiry ジョブ
 * 何を: ジョブ実行の結果(成否/ログ/プレビュー行)
 * なぜ: 失敗時も含めて常に構造化ログを返すため
 */
package com.example.password_expiry.model;

import java.util.List;

public record JobResult(boolean success, List<JobLogEntry> logs, List<PreviewRow> previewRows) {

  public JobResult {
    logs = logs == null ? List.of() : List.copyOf(logs);
    previewRows = previewRows == null ? List.of() : List.copyOf(previewRows);
  }
}
