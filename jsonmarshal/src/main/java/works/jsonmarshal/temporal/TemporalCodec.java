package works.jsonmarshal.temporal;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;

import static java.time.format.DateTimeFormatter.ISO_DATE_TIME;
import static java.time.format.DateTimeFormatter.ISO_LOCAL_DATE;

/**
 * Converts timestamps and calendar dates to and from strings.
 * <p>
 * Without a custom format, timestamps are written to the second, with a {@code ±HH:MM} offset
 * when they have one, and dates are written as {@code YYYY-MM-DD}.
 * When reading, a trailing {@code Z} is taken to mean {@code +00:00},
 * and a timestamp without an offset is taken to be UTC
 * if the target type needs one.
 *
 * @param datetimeFormat overrides the timestamp format, or null for ISO-8601
 * @param dateFormat overrides the date format, or null for ISO-8601
 */
public record TemporalCodec(DateTimeFormatter datetimeFormat, DateTimeFormatter dateFormat) {
	public static final DateTimeFormatter DEFAULT_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");
	public static final DateTimeFormatter DEFAULT_LOCAL_TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");

	public String formatTimestamp(TemporalAccessor timestamp) {
		if (datetimeFormat != null) {
			return datetimeFormat.format(timestamp);
		} else if (timestamp instanceof LocalDateTime) {
			return DEFAULT_LOCAL_TIMESTAMP_FORMAT.format(timestamp);
		} else {
			return DEFAULT_TIMESTAMP_FORMAT.format(timestamp);
		}
	}

	public String formatDate(LocalDate date) {
		return (dateFormat == null ? ISO_LOCAL_DATE : dateFormat).format(date);
	}

	/**
	 * @param targetType one of {@link OffsetDateTime}, {@link ZonedDateTime} or {@link LocalDateTime}
	 * @throws DateTimeException if {@code text} can't be parsed into {@code targetType}
	 */
	public Object parseTimestamp(String text, Class<?> targetType) {
		TemporalAccessor parsed;
		if (datetimeFormat == null) {
			if (text.endsWith("Z")) {
				text = text.substring(0, text.length() - 1) + "+00:00";
			}
			parsed = ISO_DATE_TIME.parse(text);
		} else {
			parsed = datetimeFormat.parse(text);
		}
		ZoneOffset offset = parsed.query(TemporalQueries.offset());
		if (targetType == LocalDateTime.class) {
			return LocalDateTime.from(parsed);
		} else if (targetType == OffsetDateTime.class) {
			return (offset == null)
				? LocalDateTime.from(parsed).atOffset(ZoneOffset.UTC)
				: OffsetDateTime.from(parsed);
		} else if (targetType == ZonedDateTime.class) {
			return (parsed.query(TemporalQueries.zone()) == null)
				? LocalDateTime.from(parsed).atZone(ZoneOffset.UTC)
				: ZonedDateTime.from(parsed);
		} else {
			throw new IllegalArgumentException("Not a timestamp type: " + targetType);
		}
	}

	/**
	 * @throws DateTimeException if {@code text} can't be parsed
	 */
	public LocalDate parseDate(String text) {
		return LocalDate.from((dateFormat == null ? ISO_LOCAL_DATE : dateFormat).parse(text));
	}
}
