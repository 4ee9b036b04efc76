/*
 * どこで: Password expiry アプリの設定バインド
 * 何を: JSON コレクションの保存先ディレクトリを保持する
 * なぜ: 環境ごとに設定/キュー/履歴ファイルの置き場所を切り替えるため
 */
package com.example.password_expiry.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "password-expiry.storage")
@Validated
public record StorageProperties(@NotBlank String directory) {}
