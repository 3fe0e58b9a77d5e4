package br.edu.ifba.kgrag.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingType;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token counting for chunk metadata.
 *
 * <p>Uses jtokkit's cl100k_base encoding. When the encoding cannot be loaded
 * it falls back to a mixed-script estimate: one token per CJK ideograph plus
 * 1.3 tokens per Latin word.</p>
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    private static final Pattern CJK = Pattern.compile("[\\u4e00-\\u9fff]");
    private static final Pattern LATIN_WORD = Pattern.compile("[A-Za-z]+");
    private static final double TOKENS_PER_WORD = 1.3;

    private static volatile Encoding encoding;
    private static volatile boolean initializationFailed = false;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @Nullable
    private static Encoding getEncoding() {
        if (encoding == null && !initializationFailed) {
            synchronized (TokenUtil.class) {
                if (encoding == null && !initializationFailed) {
                    try {
                        encoding = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
                    } catch (RuntimeException e) {
                        initializationFailed = true;
                        logger.warn("Failed to initialize jtokkit, falling back to estimate: {}", e.getMessage());
                    }
                }
            }
        }
        return encoding;
    }

    /**
     * Counts tokens in {@code text}; 0 for null or empty.
     */
    public static int countTokens(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Encoding enc = getEncoding();
        if (enc != null) {
            return enc.countTokens(text);
        }
        return estimateMixedScript(text);
    }

    /**
     * CJK characters count one token each, Latin words 1.3 tokens each.
     */
    public static int estimateMixedScript(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int cjk = count(CJK.matcher(text));
        int words = count(LATIN_WORD.matcher(text));
        return cjk + (int) (words * TOKENS_PER_WORD);
    }

    private static int count(Matcher matcher) {
        int n = 0;
        while (matcher.find()) {
            n++;
        }
        return n;
    }
}
