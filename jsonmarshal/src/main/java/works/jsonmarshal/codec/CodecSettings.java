package works.jsonmarshal.codec;

import java.time.format.DateTimeFormatter;
import works.jsonmarshal.temporal.StrftimePattern;
import works.jsonmarshal.temporal.TemporalCodec;

/**
 * Options shared by marshalling and unmarshalling.
 *
 * @param datetimeFormat for timestamps, or null to use ISO-8601
 * @param dateFormat for calendar dates, or null to use ISO-8601
 */
public record CodecSettings(
	DateTimeFormatter datetimeFormat,
	DateTimeFormatter dateFormat
) {
	public static final CodecSettings DEFAULT = new CodecSettings(null, null);

	public CodecSettings withDatetimeFormat(DateTimeFormatter datetimeFormat) {
		return new CodecSettings(datetimeFormat, dateFormat);
	}

	public CodecSettings withDateFormat(DateTimeFormatter dateFormat) {
		return new CodecSettings(datetimeFormat, dateFormat);
	}

	/**
	 * @param strftimePattern like {@code "%d %b %Y %H:%M"}
	 */
	public CodecSettings withDatetimePattern(String strftimePattern) {
		return withDatetimeFormat(StrftimePattern.toFormatter(strftimePattern));
	}

	/**
	 * @param strftimePattern like {@code "%d %b %Y"}
	 */
	public CodecSettings withDatePattern(String strftimePattern) {
		return withDateFormat(StrftimePattern.toFormatter(strftimePattern));
	}

	TemporalCodec temporalCodec() {
		return new TemporalCodec(datetimeFormat, dateFormat);
	}
}
