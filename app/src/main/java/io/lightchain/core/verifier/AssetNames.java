package io.lightchain.core.verifier;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Asset naming rules: main names, {@code /}-separated sub names, {@code #} unique tags, {@code $}
 * restricted and {@code #} qualifier roots, and the {@code !} owner suffix.
 */
public final class AssetNames {
    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 31;
    public static final int MAX_SUBSCRIPTION_LENGTH = 32;

    private static final Pattern DOUBLE_PUNCTUATION = Pattern.compile("^.*[._]{2,}.*$");
    private static final Pattern LEADING_PUNCTUATION = Pattern.compile("^[._].*$");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("^.*[._]$");
    private static final Pattern RAVEN_NAMES =
            Pattern.compile("^RVN$|^RAVEN$|^RAVENCOIN$|^#RVN$|^#RAVEN$|^#RAVENCOIN$");
    private static final Pattern MAIN_CHECK = Pattern.compile("^[A-Z0-9._]{3,}$");
    private static final Pattern SUB_CHECK = Pattern.compile("^[A-Z0-9._]+$");
    private static final Pattern UNIQUE_CHECK = Pattern.compile("^[-A-Za-z0-9@$%&*()\\[\\]{}_.?:]+$");

    private AssetNames() {}

    public static boolean isValid(String name) {
        if (name == null || name.length() < MIN_LENGTH || name.length() > MAX_LENGTH) {
            return false;
        }
        if (name.charAt(0) == '$') {
            return mainNameError(name.substring(1)).isEmpty();
        }
        if (name.charAt(0) == '#') {
            for (String part : name.split("/", -1)) {
                if (part.isEmpty() || mainNameError(part.substring(1)).isPresent()) {
                    return false;
                }
            }
            return true;
        }
        String base = name.endsWith("!") ? name.substring(0, name.length() - 1) : name;
        String[] subs = base.split("/", -1);
        if (mainNameError(subs[0]).isPresent()) {
            return false;
        }
        if (subs.length < 2) {
            return true;
        }
        for (int i = 1; i < subs.length - 1; i++) {
            if (subNameError(subs[i]).isPresent()) {
                return false;
            }
        }
        String[] tail = subs[subs.length - 1].split("#", -1);
        if (tail.length == 1) {
            return subNameError(tail[0]).isEmpty();
        }
        if (tail.length == 2) {
            return subNameError(tail[0]).isEmpty() && uniqueTagError(tail[1]).isEmpty();
        }
        return false;
    }

    public static Optional<String> mainNameError(String name) {
        if (DOUBLE_PUNCTUATION.matcher(name).find()) {
            return Optional.of("There is double punctuation in this main asset name.");
        }
        if (LEADING_PUNCTUATION.matcher(name).find()) {
            return Optional.of("You cannot begin a main asset with punctuation.");
        }
        if (TRAILING_PUNCTUATION.matcher(name).find()) {
            return Optional.of("You cannot end a main asset with punctuation.");
        }
        if (RAVEN_NAMES.matcher(name).find()) {
            return Optional.of("Main assets cannot have Ravencoin-like names.");
        }
        return MAIN_CHECK.matcher(name).find() ? Optional.empty() : Optional.of("SIZE");
    }

    public static Optional<String> subNameError(String name) {
        if (DOUBLE_PUNCTUATION.matcher(name).find()) {
            return Optional.of("There is double punctuation in this sub asset name.");
        }
        if (LEADING_PUNCTUATION.matcher(name).find()) {
            return Optional.of("You cannot begin a sub asset with punctuation.");
        }
        if (TRAILING_PUNCTUATION.matcher(name).find()) {
            return Optional.of("You cannot end a sub asset with punctuation.");
        }
        return SUB_CHECK.matcher(name).find()
                ? Optional.empty()
                : Optional.of("Sub assets may only use capital letters, numbers, '_', and '.'");
    }

    public static Optional<String> uniqueTagError(String tag) {
        return UNIQUE_CHECK.matcher(tag).find() ? Optional.empty() : Optional.of("Invalid characters.");
    }
}
