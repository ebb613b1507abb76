package dumb.normcode.perceive;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A tagged reference to something the runtime resolves before use: {@code %{norm}id(signifier)}.
 * The norm is optional; an untagged sign {@code %id(x)} perceives to its signifier.
 */
public record PerceptualSign(@Nullable String norm, String id, String signifier) {

    private static final Pattern SIGN = Pattern.compile("^%(\\{([a-zA-Z0-9_]+)})?([a-zA-Z0-9]*)\\((.*)\\)$", Pattern.DOTALL);

    public PerceptualSign {
        id = id == null ? "" : id;
        signifier = signifier == null ? "" : signifier;
    }

    public static PerceptualSign of(@Nullable String norm, String signifier) {
        return new PerceptualSign(norm, shortId(signifier), signifier);
    }

    public static Optional<PerceptualSign> parse(@Nullable String s) {
        if (s == null) return Optional.empty();
        var m = SIGN.matcher(s.strip());
        if (!m.matches()) return Optional.empty();
        return Optional.of(new PerceptualSign(m.group(2), m.group(3), m.group(4)));
    }

    public static boolean isSign(@Nullable String s) {
        return s != null && s.startsWith("%") && SIGN.matcher(s.strip()).matches();
    }

    /** Deterministic three-hex-digit id, so the same payload always encodes to the same sign. */
    public static String shortId(String payload) {
        return digest(payload).substring(0, 3);
    }

    public static String digest(String payload) {
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    public String encode() {
        return "%" + (norm != null ? "{" + norm + "}" : "") + id + "(" + signifier + ")";
    }

    @Override
    public String toString() {
        return encode();
    }
}
