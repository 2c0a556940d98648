package info.isaksson.erland.reacttoangular.parse;

import java.util.Map;

/**
 * Decodes the HTML character references JSX allows in text and attribute strings
 * ({@code &amp;}, {@code &nbsp;}, {@code &#123;}, {@code &#x7B;}). Unknown names are left as written.
 */
final class HtmlEntities {

    private static final Map<String, String> NAMED = Map.ofEntries(
            Map.entry("amp", "&"),
            Map.entry("lt", "<"),
            Map.entry("gt", ">"),
            Map.entry("quot", "\""),
            Map.entry("apos", "'"),
            Map.entry("nbsp", "\u00A0"),
            Map.entry("copy", "©"),
            Map.entry("reg", "®"),
            Map.entry("trade", "™"),
            Map.entry("hellip", "…"),
            Map.entry("mdash", "—"),
            Map.entry("ndash", "–"),
            Map.entry("lsquo", "‘"),
            Map.entry("rsquo", "’"),
            Map.entry("ldquo", "“"),
            Map.entry("rdquo", "”"),
            Map.entry("laquo", "«"),
            Map.entry("raquo", "»"),
            Map.entry("middot", "·"),
            Map.entry("bull", "•"),
            Map.entry("times", "×"),
            Map.entry("divide", "÷"),
            Map.entry("deg", "°"),
            Map.entry("plusmn", "±"),
            Map.entry("euro", "€"),
            Map.entry("pound", "£"),
            Map.entry("yen", "¥"),
            Map.entry("cent", "¢"),
            Map.entry("sect", "§"),
            Map.entry("para", "¶"),
            Map.entry("larr", "←"),
            Map.entry("rarr", "→"),
            Map.entry("uarr", "↑"),
            Map.entry("darr", "↓"),
            Map.entry("hearts", "♥"),
            Map.entry("check", "✓")
    );

    private HtmlEntities() {}

    static String decode(String text) {
        if (text == null || text.indexOf('&') < 0) return text;
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int semi = c == '&' ? text.indexOf(';', i + 1) : -1;
            if (semi < 0 || semi - i > 10) {
                out.append(c);
                i++;
                continue;
            }
            String replacement = reference(text.substring(i + 1, semi));
            if (replacement == null) {
                out.append(c);
                i++;
            } else {
                out.append(replacement);
                i = semi + 1;
            }
        }
        return out.toString();
    }

    private static String reference(String name) {
        if (!name.startsWith("#")) return NAMED.get(name);
        boolean hex = name.startsWith("#x") || name.startsWith("#X");
        String digits = name.substring(hex ? 2 : 1);
        if (digits.isEmpty()) return null;
        int codePoint = 0;
        for (char d : digits.toCharArray()) {
            int v = Character.digit(d, hex ? 16 : 10);
            if (v < 0 || codePoint > Character.MAX_CODE_POINT) return null;
            codePoint = codePoint * (hex ? 16 : 10) + v;
        }
        return Character.isValidCodePoint(codePoint) ? new String(Character.toChars(codePoint)) : null;
    }
}
