package com.sem.lcs.util;

import com.sem.lcs.api.LatentVariable;
import com.sem.lcs.api.ManifestVariable;
import com.sem.lcs.api.MeanSource;
import com.sem.lcs.api.Variable;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reverse of {@link Variable#name()}: turns a rendered name back into the
 * typed variable it was printed from.
 *
 * <pre>
 *   y0       initial level of Y
 *   ya       initial slope of Y
 *   lY_T3    state of Y at occasion 3
 *   dY_T3    change of Y into occasion 3
 *   Y_T3     single indicator of Y at occasion 3
 *   Y2_T3    indicator 2 of Y at occasion 3
 *   one      mean source
 * </pre>
 */
public final class VariableNames {
    private static final Pattern LEVEL = Pattern.compile("([a-z]+)0");
    private static final Pattern SLOPE = Pattern.compile("([a-z]+)a");
    private static final Pattern STATE = Pattern.compile("l([A-Z]+)_T(\\d+)");
    private static final Pattern CHANGE = Pattern.compile("d([A-Z]+)_T(\\d+)");
    private static final Pattern MANIFEST = Pattern.compile("([A-Z]+)(\\d+)?_T(\\d+)");

    private VariableNames() {
        // Utility class
    }

    /**
     * Parses a rendered variable name.
     *
     * @return The variable, or {@code null} if the name follows no known form.
     */
    public static Variable parse(String name) {
        if (name == null)
            return null;
        if (MeanSource.NAME.equals(name) || "1".equals(name))
            return MeanSource.INSTANCE;
        try {
            Matcher m;
            if ((m = LEVEL.matcher(name)).matches())
                return LatentVariable.level(m.group(1).toUpperCase(Locale.ROOT));
            if ((m = SLOPE.matcher(name)).matches())
                return LatentVariable.slope(m.group(1).toUpperCase(Locale.ROOT));
            if ((m = STATE.matcher(name)).matches())
                return LatentVariable.state(m.group(1), Integer.parseInt(m.group(2)));
            if ((m = CHANGE.matcher(name)).matches())
                return LatentVariable.change(m.group(1), Integer.parseInt(m.group(2)));
            if ((m = MANIFEST.matcher(name)).matches()) {
                int t = Integer.parseInt(m.group(3));
                if (m.group(2) == null)
                    return new ManifestVariable(m.group(1), 1, t, true);
                return new ManifestVariable(m.group(1), Integer.parseInt(m.group(2)), t, false);
            }
        } catch (IllegalArgumentException e) {
            // out-of-range occasion or indicator in an otherwise well-formed name
            return null;
        }
        return null;
    }
}
