package com.flamingo.ai.slunk.service.context;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Glossary of emoji and chat abbreviations that carry meaning on their own. */
public enum ShortMessageMeaning {
  THUMBS_UP("👍", Category.APPROVAL, "approval, agreement, or acknowledgment"),
  THUMBS_DOWN("👎", Category.DISAPPROVAL, "disapproval or disagreement"),
  CHECK_MARK("✅", Category.COMPLETION, "completion, confirmation, or approval"),
  CROSS_MARK("❌", Category.DISAPPROVAL, "rejection, cancellation, or error"),
  SIREN("🚨", Category.ALERT, "urgent alert or critical issue"),
  FIRE("🔥", Category.ALERT, "urgent, critical, or high priority"),
  HUNDRED("💯", Category.APPROVAL, "complete agreement or strong approval"),
  TADA("🎉", Category.REACTION, "celebration of a success"),
  LAUGHING("😂", Category.REACTION, "humorous response or amusement"),
  THINKING("🤔", Category.QUESTION, "thinking, considering, or questioning"),
  EYES("👀", Category.STATUS, "looking into it"),
  MUSCLE("💪", Category.STATUS, "confidence or readiness"),
  PRAY("🙏", Category.ACKNOWLEDGEMENT, "thanks or a polite request"),
  LGTM("lgtm", Category.APPROVAL, "looks good to me, approval"),
  SGTM("sgtm", Category.APPROVAL, "sounds good to me, agreement"),
  SHIP_IT("ship it", Category.APPROVAL, "approval to release"),
  ACK("ack", Category.ACKNOWLEDGEMENT, "acknowledged"),
  OK("ok", Category.ACKNOWLEDGEMENT, "acknowledgment or agreement"),
  OKAY("okay", Category.ACKNOWLEDGEMENT, "acknowledgment or agreement"),
  YES("yes", Category.APPROVAL, "agreement or confirmation"),
  NO("no", Category.DISAPPROVAL, "disagreement or refusal"),
  THANKS("thanks", Category.ACKNOWLEDGEMENT, "gratitude and acknowledgment"),
  TY("ty", Category.ACKNOWLEDGEMENT, "thank you, acknowledgment"),
  DONE("done", Category.COMPLETION, "task completed"),
  WIP("wip", Category.STATUS, "work in progress"),
  ETA("eta", Category.QUESTION, "asking for the estimated time of arrival"),
  FYI("fyi", Category.INFORMATION, "for your information"),
  TLDR("tl;dr", Category.INFORMATION, "too long; didn't read, summary request"),
  PTAL("ptal", Category.QUESTION, "please take a look, review request"),
  IMO("imo", Category.INFORMATION, "in my opinion");

  /** Broad communicative function of a glossary entry. */
  public enum Category {
    APPROVAL,
    DISAPPROVAL,
    ACKNOWLEDGEMENT,
    COMPLETION,
    STATUS,
    ALERT,
    QUESTION,
    INFORMATION,
    REACTION
  }

  private static final Map<String, ShortMessageMeaning> BY_TOKEN =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(m -> m.token, Function.identity()));

  private final String token;
  private final Category category;
  private final String gloss;

  ShortMessageMeaning(String token, Category category, String gloss) {
    this.token = token;
    this.category = category;
    this.gloss = gloss;
  }

  public String getToken() {
    return token;
  }

  public Category getCategory() {
    return category;
  }

  public String getGloss() {
    return gloss;
  }

  /**
   * Looks up a whole message in the glossary. Case, surrounding whitespace and punctuation,
   * emoji variation selectors and skin-tone modifiers are ignored.
   */
  public static Optional<ShortMessageMeaning> lookup(String content) {
    if (content == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_TOKEN.get(normalize(content)));
  }

  static String normalize(String content) {
    StringBuilder normalized = new StringBuilder();
    content
        .trim()
        .toLowerCase(Locale.ROOT)
        .codePoints()
        .filter(cp -> cp != 0xFE0F && (cp < 0x1F3FB || cp > 0x1F3FF))
        .forEach(normalized::appendCodePoint);
    return normalized.toString().replaceAll("[.!]+$", "").trim();
  }
}
