package works.jsonmarshal.temporal;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import org.junit.jupiter.api.Test;

import static java.time.ZoneOffset.UTC;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TemporalCodecTest {
	static final TemporalCodec ISO = new TemporalCodec(null, null);

	@Test
	void formatDefaults() {
		assertEquals("2020-06-23T11:12:13+00:00", ISO.formatTimestamp(OffsetDateTime.of(2020, 6, 23, 11, 12, 13, 500, UTC)));
		assertEquals("2020-06-23T11:12:13+02:00", ISO.formatTimestamp(ZonedDateTime.of(2020, 6, 23, 11, 12, 13, 0, ZoneId.of("Europe/Paris"))));
		assertEquals("2020-06-23T11:12:13", ISO.formatTimestamp(LocalDateTime.of(2020, 6, 23, 11, 12, 13)));
		assertEquals("2020-06-23", ISO.formatDate(LocalDate.of(2020, 6, 23)));
	}

	@Test
	void parseOffsets() {
		OffsetDateTime expected = OffsetDateTime.of(2020, 6, 23, 11, 12, 13, 0, UTC);
		assertEquals(expected, ISO.parseTimestamp("2020-06-23T11:12:13Z", OffsetDateTime.class));
		assertEquals(expected, ISO.parseTimestamp("2020-06-23T11:12:13+00:00", OffsetDateTime.class));
		assertEquals(expected, ISO.parseTimestamp("2020-06-23T11:12:13", OffsetDateTime.class));
		assertEquals(
			OffsetDateTime.of(2020, 6, 23, 11, 12, 13, 250_000_000, ZoneOffset.ofHours(5)),
			ISO.parseTimestamp("2020-06-23T11:12:13.25+05:00", OffsetDateTime.class));
	}

	@Test
	void parseOtherTargets() {
		assertEquals(LocalDateTime.of(2020, 6, 23, 11, 12, 13), ISO.parseTimestamp("2020-06-23T11:12:13+05:00", LocalDateTime.class));
		assertEquals(ZonedDateTime.of(2020, 6, 23, 11, 12, 13, 0, UTC), ISO.parseTimestamp("2020-06-23T11:12:13", ZonedDateTime.class));
		assertThrows(IllegalArgumentException.class, () -> ISO.parseTimestamp("2020-06-23T11:12:13", LocalDate.class));
	}

	@Test
	void customFormats() {
		TemporalCodec codec = new TemporalCodec(
			StrftimePattern.toFormatter("%d %b %Y %H:%M"),
			StrftimePattern.toFormatter("%d/%m/%Y"));
		assertEquals("23 Jun 2020 11:12", codec.formatTimestamp(OffsetDateTime.of(2020, 6, 23, 11, 12, 13, 0, UTC)));
		assertEquals(OffsetDateTime.of(2020, 6, 23, 11, 12, 0, 0, UTC), codec.parseTimestamp("23 Jun 2020 11:12", OffsetDateTime.class));
		assertEquals("23/06/2020", codec.formatDate(LocalDate.of(2020, 6, 23)));
		assertEquals(LocalDate.of(2020, 6, 23), codec.parseDate("23/06/2020"));
	}

	@Test
	void malformed_throws() {
		assertThrows(DateTimeException.class, () -> ISO.parseTimestamp("yesterday", OffsetDateTime.class));
		assertThrows(DateTimeException.class, () -> ISO.parseDate("2020-13-01"));
		assertThrows(DateTimeException.class, () -> ISO.parseDate("2020-06-23T11:12:13"));
	}
}
