/*
 * どこで: Password expiry サービス層
 * 何を: 対象ユーザー解決→期限判定→重複確認→即時送信/キュー投入を 1 ジョブとして実行する
 * なぜ: プレビュー/テスト/ライブの 3 モードを同じ判定経路で扱い、ライブ以外で実ユーザーに送らないため
 */
package com.example.password_expiry.service;

import com.example.common.TraceIds;
import com.example.password_expiry.config.JobProperties;
import com.example.password_expiry.directory.DirectoryClient;
import com.example.password_expiry.directory.DirectoryClientFactory;
import com.example.password_expiry.directory.DirectoryIntegrationException;
import com.example.password_expiry.mail.MailTransport;
import com.example.password_expiry.mail.MailTransportFactory;
import com.example.password_expiry.mail.OutgoingMail;
import com.example.password_expiry.model.AppSettings;
import com.example.password_expiry.model.DirectoryUser;
import com.example.password_expiry.model.ExpiryState;
import com.example.password_expiry.model.JobMode;
import com.example.password_expiry.model.JobRequest;
import com.example.password_expiry.model.JobResult;
import com.example.password_expiry.model.NotificationProfile;
import com.example.password_expiry.model.PreviewRow;
import com.example.password_expiry.model.QueueItem;
import com.example.password_expiry.model.QueueItemStatus;
import com.example.password_expiry.model.RecipientPolicy;
import com.example.password_expiry.repository.PersistenceException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiryNotificationJobService {

  static final String MDC_JOB_RUN_ID = "job_run_id";
  private static final Pattern MAIL_ADDRESS = Pattern.compile("^[^@\\s]+@[^@\\s]+$");

  private final SettingsStore settingsStore;
  private final DirectoryClientFactory directoryClientFactory;
  private final MailTransportFactory mailTransportFactory;
  private final ExpiryCalculator expiryCalculator;
  private final CadenceMatcher cadenceMatcher;
  private final AuditLedger auditLedger;
  private final DeliveryQueue deliveryQueue;
  private final MessageTemplateRenderer renderer;
  private final DeliveryScheduleResolver scheduleResolver;
  private final JobProperties jobProperties;
  private final ExpiryNotificationMetrics metrics;
  private final Clock clock;
  private final ZoneId businessZone;

  public JobResult runJob(JobRequest request) {
    final JobLogCollector log = new JobLogCollector(clock);
    final JobMode mode = request.mode() == null ? JobMode.PREVIEW : request.mode();
    final NotificationProfile profile = request.profile();
    try (TraceIds.MdcScope ignored =
        TraceIds.putScoped(MDC_JOB_RUN_ID, TraceIds.newTraceId())) {
      final String profileName = profile == null ? "(no profile)" : profile.name();
      log.info("Job initiated: " + profileName + " (" + mode + ")");
      try {
        final RunContext context = prepare(request, mode, log);
        final RunCounters counters = new RunCounters();
        for (AudienceMember member : context.audience()) {
          processMember(member, context, counters, log);
        }
        log.success(
            String.format(
                "Job finished. Processed %d users. Matched %d. Sent %d. Queued %d. Skipped %d.",
                context.audience().size(),
                counters.matched,
                counters.sent,
                counters.queued,
                counters.skipped));
        if (counters.failed > 0) {
          log.warn("Some users could not be notified", counters.failed + " failures");
        }
        metrics.recordJobRun(mode, true);
        return new JobResult(true, log.entries(), context.previewRows());
      } catch (JobAbortedException ex) {
        log.error("Job failed: " + ex.getMessage(), causeMessage(ex));
        metrics.recordJobRun(mode, false);
        return new JobResult(false, log.entries(), List.of());
      }
    }
  }

  private RunContext prepare(JobRequest request, JobMode mode, JobLogCollector log) {
    final NotificationProfile profile = request.profile();
    if (profile == null) {
      throw new JobAbortedException("a notification profile is required");
    }
    if (mode == JobMode.TEST) {
      final String testRecipient = request.testRecipient();
      if (testRecipient == null || !MAIL_ADDRESS.matcher(testRecipient.trim()).matches()) {
        throw new JobAbortedException("test mode requires a valid test recipient address");
      }
    }
    if (mode == JobMode.LIVE && (profile.id() == null || profile.id().isBlank())) {
      throw new JobAbortedException("live mode requires a saved profile with an id");
    }
    try {
      renderer.validate(profile.subjectTemplate());
      renderer.validate(profile.emailTemplate());
    } catch (TemplateRenderException ex) {
      throw new JobAbortedException(ex.getMessage(), ex);
    }

    final AppSettings settings = settingsStore.load();
    final Instant now = Instant.now(clock);
    final Optional<Instant> scheduleAt =
        scheduleResolver
            .resolve(request.scheduleAt(), profile, mode, now)
            .filter(at -> at.isAfter(now));
    final List<AudienceMember> audience;
    try {
      final DirectoryClient directory = directoryClientFactory.create(settings);
      audience = resolveAudience(profile, directory, log);
      MailTransport transport = null;
      if (mode != JobMode.PREVIEW && scheduleAt.isEmpty()) {
        if (!settings.smtp().isConfigured()) {
          throw new JobAbortedException("SMTP host is not configured");
        }
        transport = mailTransportFactory.create(settings.smtp());
      }
      scheduleAt.ifPresent(at -> log.info("Messages will be queued for delivery at " + at));
      return new RunContext(
          profile,
          mode,
          request.testRecipient() == null ? null : request.testRecipient().trim(),
          settings,
          directory,
          transport,
          scheduleAt,
          now,
          LocalDate.ofInstant(now, businessZone),
          audience,
          new ArrayList<>());
    } catch (DirectoryIntegrationException ex) {
      throw new JobAbortedException(ex.getMessage(), ex);
    }
  }

  private List<AudienceMember> resolveAudience(
      NotificationProfile profile, DirectoryClient directory, JobLogCollector log) {
    final List<String> groups = profile.assignedGroupNames();
    if (groups.isEmpty()) {
      throw new JobAbortedException("profile has no assigned groups");
    }
    final Map<String, AudienceMember> members = new LinkedHashMap<>();
    if (groups.stream().anyMatch(jobProperties::isAllUsers)) {
      final List<DirectoryUser> users = directory.listUsers();
      for (DirectoryUser user : users) {
        members.putIfAbsent(user.id(), new AudienceMember(user, jobProperties.allUsersGroup()));
      }
      log.info("Loaded " + users.size() + " users from the directory");
    } else {
      for (String group : groups) {
        final List<DirectoryUser> users = directory.listGroupMembers(group);
        // 複数グループに属するユーザーは最初に見つかったグループで扱う
        for (DirectoryUser user : users) {
          members.putIfAbsent(user.id(), new AudienceMember(user, group));
        }
        log.info("Group '" + group + "' resolved to " + users.size() + " users");
      }
    }
    return List.copyOf(members.values());
  }

  private void processMember(
      AudienceMember member, RunContext context, RunCounters counters, JobLogCollector log) {
    final DirectoryUser user = member.user();
    if (!user.accountEnabled()) {
      return;
    }
    final ExpiryState state =
        expiryCalculator.computeExpiry(
            user, context.settings().effectiveExpiryDays(), context.now());
    if (!cadenceMatcher.matches(state, context.profile())) {
      return;
    }
    counters.matched++;
    if (context.mode() == JobMode.PREVIEW) {
      context
          .previewRows()
          .add(
              new PreviewRow(
                  user.displayName(),
                  user.principalName(),
                  state.daysRemaining(),
                  state.expiresAt(),
                  member.groupLabel()));
      return;
    }
    try {
      deliver(user, state, context, counters, log);
    } catch (PersistenceException ex) {
      // 書き込み失敗を無視すると二重送信やキュー消失につながるため以降を止める
      throw new JobAbortedException("storage write failed for " + user.principalName(), ex);
    } catch (RuntimeException ex) {
      counters.failed++;
      log.error("Processing failed for " + user.principalName(), ex.getMessage());
    }
  }

  private void deliver(
      DirectoryUser user,
      ExpiryState state,
      RunContext context,
      RunCounters counters,
      JobLogCollector log) {
    final NotificationProfile profile = context.profile();
    if (context.mode() == JobMode.LIVE
        && auditLedger.wasAlreadySent(user.principalName(), profile.id(), context.today())) {
      counters.skipped++;
      log.skip("Already sent today to " + user.principalName());
      auditLedger.recordSkipped(
          user.principalName(), profile.id(), context.today(), Instant.now(clock));
      return;
    }
    final Optional<Recipients> recipients = resolveRecipients(user, context, log);
    if (recipients.isEmpty()) {
      counters.skipped++;
      log.warn(
          "No recipient for " + user.principalName(),
          "user delivery is disabled and no cc or manager address is available");
      return;
    }
    final RenderedMessage message = renderer.render(profile, user, state);
    final boolean readReceipt = profile.recipientPolicy().requestReadReceipt();
    final String to = recipients.get().to();

    if (context.scheduleAt().isPresent()) {
      final boolean live = context.mode() == JobMode.LIVE;
      deliveryQueue.enqueue(
          new QueueItem(
              null,
              context.scheduleAt().get(),
              to,
              recipients.get().cc(),
              message.subject(),
              message.body(),
              profile.id(),
              profile.name(),
              QueueItemStatus.PENDING,
              0,
              readReceipt,
              Instant.now(clock),
              live ? user.principalName() : null,
              live ? context.today() : null));
      counters.queued++;
      log.queue("Queued for " + to + " at " + context.scheduleAt().get());
      // 予約時点で送信済みとして記録し、同日の再実行で二重に積まない
      recordLiveSend(user, context);
      return;
    }

    try {
      context
          .transport()
          .send(
              new OutgoingMail(
                  context.settings().smtp().fromEmail(),
                  to,
                  recipients.get().cc(),
                  message.subject(),
                  message.body(),
                  readReceipt));
    } catch (RuntimeException ex) {
      counters.failed++;
      log.error("Send failed for " + to, ex.getMessage());
      return;
    }
    counters.sent++;
    log.success("Sent to " + to + " (" + state.daysRemaining() + " days remaining)");
    recordLiveSend(user, context);
  }

  private void recordLiveSend(DirectoryUser user, RunContext context) {
    if (context.mode() != JobMode.LIVE) {
      return;
    }
    auditLedger.recordSent(
        user.principalName(), context.profile().id(), context.today(), Instant.now(clock));
  }

  private Optional<Recipients> resolveRecipients(
      DirectoryUser user, RunContext context, JobLogCollector log) {
    final RecipientPolicy policy = context.profile().recipientPolicy();
    final List<String> cc = new ArrayList<>(policy.ccAddresses());
    if (policy.toManagerLookup()) {
      try {
        context
            .directory()
            .findManagerAddress(user.id())
            .filter(address -> cc.stream().noneMatch(address::equalsIgnoreCase))
            .ifPresent(cc::add);
      } catch (RuntimeException ex) {
        log.warn("Manager lookup failed for " + user.principalName(), ex.getMessage());
      }
    }
    final String to;
    if (context.mode() == JobMode.TEST) {
      to = context.testRecipient();
    } else if (policy.toUser()) {
      to = user.principalName();
    } else if (!cc.isEmpty()) {
      to = cc.remove(0);
    } else {
      return Optional.empty();
    }
    if (to == null || to.isBlank()) {
      return Optional.empty();
    }
    cc.removeIf(to::equalsIgnoreCase);
    return Optional.of(new Recipients(to, cc));
  }

  private static String causeMessage(Throwable ex) {
    final Throwable cause = ex.getCause();
    return cause == null || cause.getMessage() == null ? null : cause.getMessage();
  }

  private record AudienceMember(DirectoryUser user, String groupLabel) {}

  private record Recipients(String to, List<String> cc) {}

  private record RunContext(
      NotificationProfile profile,
      JobMode mode,
      String testRecipient,
      AppSettings settings,
      DirectoryClient directory,
      MailTransport transport,
      Optional<Instant> scheduleAt,
      Instant now,
      LocalDate today,
      List<AudienceMember> audience,
      List<PreviewRow> previewRows) {}

  private static final class RunCounters {
    private int matched;
    private int sent;
    private int queued;
    private int skipped;
    private int failed;
  }
}
