/* Repute © 2025 Repute Devs — MIT */
package dev.repute.commands;

import dev.repute.admin.AdminAdjustmentService;
import dev.repute.admin.AdminAdjustmentService.AddResult;
import dev.repute.admin.RemovalReport;
import dev.repute.api.Card;
import dev.repute.api.ChatGateway;
import dev.repute.api.ErrorCode;
import dev.repute.api.GatewayException;
import dev.repute.api.VoteType;
import dev.repute.core.Config;
import dev.repute.core.LocaleManager;
import dev.repute.ledger.AuditSinks;
import dev.repute.ledger.DisabledVoters;
import dev.repute.ledger.ReputationLedger;
import dev.repute.ledger.UserView;
import dev.repute.ledger.VoteRecord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command surface: {@code rep}, {@code repboard} and the administrator commands {@code repadd},
 * {@code replogs}, {@code repdisable}, {@code repremove} and {@code repmanager}.
 *
 * <p>Platform adapters either call the typed methods directly or hand raw text to {@link
 * #execute}. Administrator commands check the caller's rights before parsing or mutating anything
 * and always answer ephemerally.
 */
public final class ReputationCommands {
  private static final Logger LOG = LoggerFactory.getLogger("repute");

  static final int MANAGER_VOTES = 10;

  private final ReputationLedger ledger;
  private final AdminAdjustmentService admin;
  private final DisabledVoters disabledVoters;
  private final AuditSinks auditSinks;
  private final ChatGateway gateway;
  private final Runnable flush;
  private final ReputationCards cards;

  public ReputationCommands(
      ReputationLedger ledger,
      AdminAdjustmentService admin,
      DisabledVoters disabledVoters,
      AuditSinks auditSinks,
      ChatGateway gateway,
      Runnable flush,
      Config.Bot bot) {
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.admin = Objects.requireNonNull(admin, "admin");
    this.disabledVoters = Objects.requireNonNull(disabledVoters, "disabledVoters");
    this.auditSinks = Objects.requireNonNull(auditSinks, "auditSinks");
    this.gateway = Objects.requireNonNull(gateway, "gateway");
    this.flush = Objects.requireNonNull(flush, "flush");
    this.cards = new ReputationCards(gateway, Objects.requireNonNull(bot, "bot"));
  }

  /**
   * Parses and runs a command given as text.
   *
   * @param context caller and location
   * @param command command name without prefix, case-insensitive
   * @param rawArgs remaining text; mentions ({@code <@id>}, {@code <#id>}) or raw IDs are accepted
   * @return reply to show the caller
   */
  public CommandResponse execute(CommandContext context, String command, String rawArgs) {
    String name = command == null ? "" : command.trim().toLowerCase(Locale.ROOT);
    boolean adminCommand = isAdminCommand(name);
    if (adminCommand && !context.administrator()) {
      return denied(context, name);
    }
    try {
      CommandArguments args = CommandArguments.from(rawArgs);
      return switch (name) {
        case "rep" -> {
          long target = args.hasNext() ? args.nextUser("user") : context.callerId();
          args.expectEnd();
          yield rep(context, target);
        }
        case "repboard" -> {
          args.expectEnd();
          yield repboard(context);
        }
        case "repadd" -> {
          long user = args.nextUser("user");
          String amountRaw = args.next("amount");
          String typeRaw = args.next("type");
          args.expectEnd();
          int amount;
          try {
            amount = Integer.parseInt(amountRaw);
          } catch (NumberFormatException ex) {
            yield invalidAmount(context, amountRaw);
          }
          yield repadd(context, user, amount, VoteType.fromKey(typeRaw));
        }
        case "replogs" -> {
          long channel = args.nextChannel("channel");
          args.expectEnd();
          yield replogs(context, channel);
        }
        case "repdisable" -> {
          long user = args.nextUser("user");
          args.expectEnd();
          yield repdisable(context, user);
        }
        case "repremove" -> repremove(context, args.rest());
        case "repmanager" -> {
          args.expectEnd();
          yield repmanager(context);
        }
        default ->
            CommandResponse.failure(
                ErrorCode.INVALID_ARGUMENT,
                LocaleManager.format("command.unknown", "name", name),
                true);
      };
    } catch (IllegalArgumentException ex) {
      return CommandResponse.failure(
          ErrorCode.INVALID_ARGUMENT,
          LocaleManager.format("command.invalid_argument", "message", ex.getMessage()),
          adminCommand);
    }
  }

  /** Profile of {@code targetId}; participants without votes show zeroes. */
  public CommandResponse rep(CommandContext context, long targetId) {
    UserView user = ledger.user(targetId).orElse(UserView.empty(targetId));
    return CommandResponse.success(render(cards.profile(user)), false);
  }

  /** Top participants with at least one vote who are still guild members. */
  public CommandResponse repboard(CommandContext context) {
    List<UserView> ranked = new ArrayList<>();
    try {
      for (UserView user : ledger.users()) {
        if (user.totalVotes() == 0) {
          continue;
        }
        if (gateway.isMember(context.guildId(), user.userId())) {
          ranked.add(user);
        }
      }
    } catch (GatewayException ex) {
      LOG.warn(
          "(repute) code={} op={} message={}",
          ErrorCode.GATEWAY_FAILURE,
          "commands.repboard",
          ex.getMessage(),
          ex);
      return CommandResponse.failure(
          ErrorCode.GATEWAY_FAILURE, LocaleManager.translate("command.gateway_failure"), true);
    }
    ranked.sort(ReputationCards.BOARD_ORDER);
    return CommandResponse.success(render(cards.leaderboard(ranked)), false);
  }

  /** Adds admin votes to {@code userId}. */
  public CommandResponse repadd(CommandContext context, long userId, int amount, VoteType type) {
    if (!context.administrator()) {
      return denied(context, "repadd");
    }
    if (amount <= 0) {
      return invalidAmount(context, String.valueOf(amount));
    }
    if (amount > admin.maxVotesPerAdd()) {
      LOG.debug(
          "(repute) code={} op={} message={}",
          ErrorCode.INVALID_AMOUNT,
          "commands.repadd",
          "caller " + context.callerId() + " gave amount " + amount);
      return CommandResponse.failure(
          ErrorCode.INVALID_AMOUNT,
          LocaleManager.format("command.amount_too_large", "max", admin.maxVotesPerAdd()),
          true);
    }
    AddResult result =
        admin.addVotes(context.guildId(), context.callerId(), userId, type, amount);
    if (!result.result().ok()) {
      ErrorCode code = result.result().code();
      String key =
          code == ErrorCode.INVALID_AMOUNT ? "command.invalid_amount" : "command.invalid_argument";
      return CommandResponse.failure(
          code, LocaleManager.format(key, "message", result.result().message()), true);
    }
    return CommandResponse.success(
        LocaleManager.format(
            "command.repadd.done",
            "amount", amount,
            "type", type.key(),
            "user", gateway.mention(userId)),
        true);
  }

  /** Routes the guild's audit entries to {@code channelId}. */
  public CommandResponse replogs(CommandContext context, long channelId) {
    if (!context.administrator()) {
      return denied(context, "replogs");
    }
    auditSinks.set(context.guildId(), channelId);
    flush.run();
    LOG.info(
        "(repute) op={} guild={} channel={}", "commands.replogs", context.guildId(), channelId);
    return CommandResponse.success(
        LocaleManager.format(
            "command.replogs.done", "channel", gateway.channelMention(channelId)),
        true);
  }

  /** Toggles whether {@code userId} may vote. */
  public CommandResponse repdisable(CommandContext context, long userId) {
    if (!context.administrator()) {
      return denied(context, "repdisable");
    }
    boolean disabled = disabledVoters.toggle(userId);
    flush.run();
    LOG.info(
        "(repute) op={} admin={} user={} disabled={}",
        "commands.repdisable",
        context.callerId(),
        userId,
        disabled);
    String action =
        LocaleManager.translate(
            disabled ? "command.repdisable.disabled" : "command.repdisable.enabled");
    return CommandResponse.success(
        LocaleManager.format(
            "command.repdisable.done", "user", gateway.mention(userId), "action", action),
        true);
  }

  /**
   * Reverses the comma-separated vote IDs.
   *
   * @param rawIds IDs separated by commas; whitespace around each is ignored
   */
  public CommandResponse repremove(CommandContext context, String rawIds) {
    if (!context.administrator()) {
      return denied(context, "repremove");
    }
    if (rawIds == null || rawIds.isBlank()) {
      return CommandResponse.failure(
          ErrorCode.INVALID_ARGUMENT, LocaleManager.translate("command.repremove.empty"), true);
    }
    List<String> ids = Arrays.stream(rawIds.split(",", -1)).map(String::strip).toList();
    RemovalReport report = admin.removeVotesById(context.guildId(), context.callerId(), ids);
    List<String> sections = new ArrayList<>();
    section(sections, "command.repremove.removed", report.removed());
    section(sections, "command.repremove.already_reversed", report.alreadyReversed());
    section(sections, "command.repremove.invalid", report.notFound());
    return CommandResponse.success(String.join("\n\n", sections), true);
  }

  /** The most recent active votes. */
  public CommandResponse repmanager(CommandContext context) {
    if (!context.administrator()) {
      return denied(context, "repmanager");
    }
    List<VoteRecord> votes = ledger.recentActiveVotes(MANAGER_VOTES);
    if (votes.isEmpty()) {
      return CommandResponse.success(LocaleManager.translate("command.repmanager.empty"), true);
    }
    return CommandResponse.success(render(cards.voteManager(votes, ledger::user)), true);
  }

  static boolean isAdminCommand(String name) {
    return switch (name) {
      case "repadd", "replogs", "repdisable", "repremove", "repmanager" -> true;
      default -> false;
    };
  }

  private static void section(List<String> sections, String key, List<String> ids) {
    if (ids.isEmpty()) {
      return;
    }
    StringBuilder text = new StringBuilder(LocaleManager.format(key, "count", ids.size()));
    for (String id : ids) {
      text.append('\n').append(LocaleManager.format("command.repremove.item", "id", id));
    }
    sections.add(text.toString());
  }

  private static CommandResponse denied(CommandContext context, String name) {
    LOG.info(
        "(repute) code={} op={} message={}",
        ErrorCode.PERMISSION_DENIED,
        "commands." + name,
        "caller " + context.callerId() + " is not an administrator");
    return CommandResponse.failure(
        ErrorCode.PERMISSION_DENIED, LocaleManager.translate("command.permission_denied"), true);
  }

  private static CommandResponse invalidAmount(CommandContext context, String raw) {
    LOG.debug(
        "(repute) code={} op={} message={}",
        ErrorCode.INVALID_AMOUNT,
        "commands.repadd",
        "caller " + context.callerId() + " gave amount " + raw);
    return CommandResponse.failure(
        ErrorCode.INVALID_AMOUNT, LocaleManager.translate("command.invalid_amount"), true);
  }

  private static String render(Card card) {
    if (card.title().isEmpty()) {
      return card.body();
    }
    return "**" + card.title() + "**\n" + card.body();
  }
}
