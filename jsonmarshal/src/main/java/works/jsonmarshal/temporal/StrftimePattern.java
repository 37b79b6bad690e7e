package works.jsonmarshal.temporal;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Translates C-style {@code strftime} patterns like {@code "%d %b %Y"}
 * into {@link DateTimeFormatter}s.
 * Month and day names are English.
 */
public final class StrftimePattern {
	private StrftimePattern() { }

	private static final Map<Character, String> DIRECTIVES = Map.ofEntries(
		entry('a', "EEE"),
		entry('A', "EEEE"),
		entry('d', "dd"),
		entry('b', "MMM"),
		entry('B', "MMMM"),
		entry('m', "MM"),
		entry('Y', "uuuu"),
		entry('H', "HH"),
		entry('I', "hh"),
		entry('p', "a"),
		entry('M', "mm"),
		entry('S', "ss"),
		entry('f', "SSSSSS"),
		entry('z', "xx"),
		entry('Z', "zzz"),
		entry('j', "DDD")
	);

	/**
	 * @throws IllegalArgumentException if {@code pattern} uses an unsupported directive
	 */
	public static DateTimeFormatter toFormatter(String pattern) {
		DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
		StringBuilder literal = new StringBuilder();
		for (int i = 0; i < pattern.length(); i++) {
			char c = pattern.charAt(i);
			if (c != '%') {
				literal.append(c);
				continue;
			}
			if (++i == pattern.length()) {
				throw new IllegalArgumentException("Pattern ends with an incomplete directive: \"" + pattern + "\"");
			}
			char directive = pattern.charAt(i);
			if (directive == '%') {
				literal.append('%');
				continue;
			}
			if (directive == 'y') {
				flushLiteral(builder, literal);
				// Two-digit years 69-99 are 1969-1999 and 00-68 are 2000-2068
				builder.appendValueReduced(ChronoField.YEAR, 2, 2, 1969);
				continue;
			}
			String replacement = DIRECTIVES.get(directive);
			if (replacement == null) {
				throw new IllegalArgumentException("Unsupported directive %" + directive + " in \"" + pattern + "\"");
			}
			flushLiteral(builder, literal);
			builder.appendPattern(replacement);
		}
		flushLiteral(builder, literal);
		return builder.toFormatter(Locale.ENGLISH);
	}

	private static void flushLiteral(DateTimeFormatterBuilder builder, StringBuilder literal) {
		if (literal.length() != 0) {
			builder.appendLiteral(literal.toString());
			literal.setLength(0);
		}
	}
}
