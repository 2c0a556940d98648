package info.isaksson.erland.reacttoangular.rules;

import java.util.Collection;
import java.util.Locale;

/** Naming helpers for selectors, file names and generated members. */
public final class NameUtil {

    private NameUtil() {}

    /** {@code TodoBox -> todo-box}, {@code Nav.Item -> nav-item}, {@code HTMLView -> html-view}. */
    public static String kebab(String name) {
        if (name == null || name.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '.' || c == '_' || c == ' ' || c == '-') {
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '-') sb.append('-');
                continue;
            }
            if (Character.isUpperCase(c)) {
                boolean prevLower = i > 0 && (Character.isLowerCase(name.charAt(i - 1)) || Character.isDigit(name.charAt(i - 1)));
                boolean nextLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                boolean prevUpper = i > 0 && Character.isUpperCase(name.charAt(i - 1));
                if (sb.length() > 0 && sb.charAt(sb.length() - 1) != '-' && (prevLower || (prevUpper && nextLower))) {
                    sb.append('-');
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** {@code todo-box -> TodoBox}, {@code todoBox -> TodoBox}. */
    public static String pascal(String name) {
        if (name == null || name.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return sb.toString();
    }

    public static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    public static String selector(String componentName) {
        return "app-" + kebab(componentName);
    }

    public static boolean isComponentName(String name) {
        return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }

    /** {@code base}, or {@code base2}, {@code base3}... whichever is not taken. */
    public static String unique(String base, Collection<String> taken) {
        if (!taken.contains(base)) return base;
        int n = 2;
        while (taken.contains(base + n)) n++;
        return base + n;
    }
}
