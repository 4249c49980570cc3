package info.isaksson.erland.reacttoangular.emitter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level rewrite of method bodies into class-member form.
 *
 * <ol>
 *   <li>State setter calls become assignments: {@code setItems([...items, v])} gives
 *   {@code this.items.push(v)} for a simple {@code v} and a spread assignment otherwise; an updater
 *   {@code setCount(c => c + 1)} is inlined; {@code setName(x)} gives {@code this.name = x}.</li>
 *   <li>Free occurrences of known names are qualified with {@code this.}, longest name first. Member
 *   positions ({@code a.name}), object-literal keys and string literals are left alone; spreads
 *   ({@code ...name}) and shorthand entries ({@code { name }}) are qualified.</li>
 *   <li>Statement lines get a terminating {@code ;}.</li>
 *   <li>Accidental {@code this.this.} collapses to {@code this.}.</li>
 * </ol>
 *
 * <p>Best effort: there is no scope analysis, so a local variable or parameter spelled like a
 * property is qualified as well. Unresolvable text is passed through unchanged.</p>
 */
public final class BodyNormalizer {

    private static final String QUALIFIER = "this.";

    private static final Pattern SIMPLE_VALUE =
            Pattern.compile("[A-Za-z_$][\\w$]*|'[^'\\\\]*'|\"[^\"\\\\]*\"|-?\\d+(?:\\.\\d+)?");
    private static final Pattern UPDATER =
            Pattern.compile("\\(?\\s*([A-Za-z_$][\\w$]*)\\s*\\)?\\s*=>\\s*(?!\\{)(.+)", Pattern.DOTALL);
    private static final Pattern SPREAD = Pattern.compile("\\.\\.\\.\\s*([A-Za-z_$][\\w$]*)");
    private static final Pattern DOUBLE_QUALIFIER = Pattern.compile("\\bthis\\.(?:this\\.)+");
    private static final char PLACEHOLDER = '\u0000';
    private static final Set<String> BLOCK_KEYWORDS = Set.of("else", "try", "finally", "do");

    private BodyNormalizer() {}

    public static String normalize(String body, Collection<String> knownNames, Map<String, String> setterMap) {
        if (body == null || body.isBlank()) return "";
        String text = rewriteSetters(body, setterMap == null ? Map.of() : setterMap);
        text = qualify(text, knownNames == null ? List.of() : knownNames);
        text = terminate(text);
        return DOUBLE_QUALIFIER.matcher(text).replaceAll(QUALIFIER);
    }

    // ---------------------------------------------------------------------------------------------
    // setter calls

    static String rewriteSetters(String text, Map<String, String> setters) {
        if (setters.isEmpty()) return text;
        StringBuilder out = new StringBuilder();
        int i = 0;
        int len = text.length();
        while (i < len) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                int end = skipString(text, i);
                out.append(text, i, end);
                i = end;
                continue;
            }
            if (!isIdentifierStart(c)) {
                out.append(c);
                i++;
                continue;
            }
            int j = i;
            while (j < len && isIdentifierPart(text.charAt(j))) j++;
            String word = text.substring(i, j);
            String property = setters.get(word);
            boolean member = i > 0 && text.charAt(i - 1) == '.';
            if (property != null && !member) {
                int open = skipSpaces(text, j);
                int close = open < len && text.charAt(open) == '(' ? matching(text, open) : -1;
                if (close > 0) {
                    String arg = text.substring(open + 1, close).trim();
                    out.append(assignment(property, rewriteSetters(arg, setters)));
                    i = close + 1;
                    continue;
                }
            }
            out.append(word);
            i = j;
        }
        return out.toString();
    }

    private static String assignment(String property, String arg) {
        String target = QUALIFIER + property;
        if (arg.isEmpty()) return target + " = undefined";

        Optional<String> appended = appendedElement(arg, property);
        if (appended.isPresent()) {
            String value = appended.get();
            return SIMPLE_VALUE.matcher(value).matches()
                    ? target + ".push(" + value + ")"
                    : target + " = [..." + target + ", " + value + "]";
        }
        Matcher updater = UPDATER.matcher(arg);
        if (updater.matches()) {
            return target + " = " + replaceWord(updater.group(2).trim(), updater.group(1), target);
        }
        return target + " = " + arg;
    }

    /** {@code v} when {@code arg} is exactly {@code [...property, v]}. */
    private static Optional<String> appendedElement(String arg, String property) {
        if (!arg.startsWith("[") || matching(arg, 0) != arg.length() - 1) return Optional.empty();
        List<String> parts = splitTopLevel(arg.substring(1, arg.length() - 1));
        if (parts.size() != 2) return Optional.empty();
        Matcher spread = SPREAD.matcher(parts.get(0).trim());
        if (!spread.matches() || !spread.group(1).equals(property)) return Optional.empty();
        String value = parts.get(1).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    // ---------------------------------------------------------------------------------------------
    // qualification

    static String qualify(String text, Collection<String> knownNames) {
        if (knownNames.isEmpty()) return text;
        TreeSet<String> names = new TreeSet<>(Comparator.comparingInt(String::length).reversed()
                .thenComparing(Comparator.naturalOrder()));
        for (String n : knownNames) {
            if (n != null && !n.isBlank()) names.add(n);
        }
        List<String> saved = new ArrayList<>();
        String protectedText = protectStrings(text, saved);
        for (String name : names) {
            protectedText = replaceFree(protectedText, name, QUALIFIER + name);
        }
        return restoreStrings(protectedText, saved);
    }

    /** Replaces free occurrences of {@code name}, leaving string literals alone. */
    private static String replaceWord(String text, String name, String replacement) {
        List<String> saved = new ArrayList<>();
        return restoreStrings(replaceFree(protectStrings(text, saved), name, replacement), saved);
    }

    /**
     * Replaces free occurrences of {@code name}. A single dot before it marks a member access and is
     * skipped; a spread ({@code ...name}) is not. Inside an object literal a key ({@code name: v}) is
     * kept and a shorthand entry ({@code { name }}) is expanded to {@code name: replacement}.
     */
    private static String replaceFree(String text, String name, String replacement) {
        Pattern p = Pattern.compile("(?<![\\w$])(?<!(?<!\\.)\\.)" + Pattern.quote(name) + "(?![\\w$])");
        Matcher m = p.matcher(text);
        StringBuilder out = new StringBuilder();
        int last = 0;
        while (m.find()) {
            out.append(text, last, m.start());
            char next = nextNonSpace(text, m.end());
            if (!inObjectKeyPosition(text, m.start())) {
                out.append(replacement);
            } else if (next == ':') {
                out.append(name);
            } else if (next == ',' || next == '}') {
                out.append(name).append(": ").append(replacement);
            } else {
                out.append(replacement);
            }
            last = m.end();
        }
        out.append(text.substring(last));
        return out.toString();
    }

    /** True when {@code pos} starts an entry of an object literal (right after its {@code {} or a {@code ,}). */
    private static boolean inObjectKeyPosition(String text, int pos) {
        int prev = previousNonSpace(text, pos);
        if (prev < 0 || (text.charAt(prev) != '{' && text.charAt(prev) != ',')) return false;
        int depth = 0;
        for (int i = pos - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == ')' || c == ']' || c == '}') {
                depth++;
            } else if (c == '(' || c == '[' || c == '{') {
                if (depth == 0) return c == '{' && isObjectBrace(text, i);
                depth--;
            }
        }
        return false;
    }

    /** An opening brace starts an object literal unless it follows a statement, an arrow or a block keyword. */
    private static boolean isObjectBrace(String text, int bracePos) {
        int prev = previousNonSpace(text, bracePos);
        if (prev < 0) return false;
        char c = text.charAt(prev);
        if (c == ')' || c == ';' || c == '{' || c == '}') return false;
        if (c == '>' && prev > 0 && text.charAt(prev - 1) == '=') return false;
        if (Character.isLetter(c)) {
            int start = prev;
            while (start > 0 && Character.isLetter(text.charAt(start - 1))) start--;
            return !BLOCK_KEYWORDS.contains(text.substring(start, prev + 1));
        }
        return true;
    }

    private static int previousNonSpace(String text, int pos) {
        int i = pos - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) i--;
        return i;
    }

    private static char nextNonSpace(String text, int pos) {
        int i = pos;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i < text.length() ? text.charAt(i) : 0;
    }

    private static String protectStrings(String text, List<String> saved) {
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                int end = skipString(text, i);
                out.append(PLACEHOLDER).append(saved.size()).append(PLACEHOLDER);
                saved.add(text.substring(i, end));
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static String restoreStrings(String text, List<String> saved) {
        String out = text;
        for (int k = saved.size() - 1; k >= 0; k--) {
            out = out.replace(PLACEHOLDER + String.valueOf(k) + PLACEHOLDER, saved.get(k));
        }
        return out;
    }

    // ---------------------------------------------------------------------------------------------
    // terminators

    static String terminate(String text) {
        String[] lines = text.split("\\R", -1);
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (needsTerminator(line)) line += ";";
            if (i > 0) out.append('\n');
            out.append(line);
        }
        return out.toString();
    }

    private static boolean needsTerminator(String line) {
        String t = line.strip();
        if (t.isEmpty()) return false;
        if (t.startsWith("//") || t.startsWith("/*") || t.startsWith("*") || t.endsWith("*/")) return false;
        char last = t.charAt(t.length() - 1);
        return ";{},([".indexOf(last) < 0;
    }

    // ---------------------------------------------------------------------------------------------
    // scanning

    /** Index of the bracket closing the one at {@code open}, or -1. Strings are skipped. */
    private static int matching(String text, int open) {
        int depth = 0;
        int i = open;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') depth++;
            if (c == ')' || c == ']' || c == '}') {
                depth--;
                if (depth == 0) return i;
            }
            i++;
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (isQuote(c)) {
                i = skipString(text, i);
                continue;
            }
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ',' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static int skipString(String text, int start) {
        char quote = text.charAt(start);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                return i + 1;
            } else {
                i++;
            }
        }
        return text.length();
    }

    private static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        return i;
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"' || c == '`';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
