package org.metricshub.vscript.runtime;

import static org.junit.Assert.*;

import org.junit.Test;

public class TimePositionTest {

	@Test
	public void testNormalization() {
		TimePosition t = new TimePosition(1, 75);
		assertEquals(2, t.getMinutes());
		assertEquals(15, t.getSeconds());
		assertEquals(135, t.getTotalSeconds());
		assertEquals(135.0, t.toSeconds(), 0.0);

		for (int m = 0; m < 5; m++) {
			for (int s = 0; s < 200; s += 7) {
				TimePosition p = new TimePosition(m, s);
				assertEquals(m * 60 + (s % 60) + 60 * (s / 60), p.toSeconds(), 0.0);
				assertTrue("seconds must be below 60: " + p, p.getSeconds() < 60);
			}
		}
	}

	@Test
	public void testToStringPadsSeconds() {
		assertEquals("3:05", new TimePosition(3, 5).toString());
		assertEquals("0:00", new TimePosition(0, 0).toString());
		assertEquals("12:59", new TimePosition(12, 59).toString());
		assertEquals("1:00", TimePosition.ofSeconds(60).toString());
	}

	@Test
	public void testParse() {
		TimePosition t = TimePosition.parse("00:10");
		assertEquals(0, t.getMinutes());
		assertEquals(10, t.getSeconds());
		assertEquals(TimePosition.parse("1:30"), TimePosition.parse("0:90"));
		assertEquals(TimePosition.parse("1:30").hashCode(), TimePosition.parse("0:90").hashCode());
		assertEquals(65, TimePosition.parse(" 1 : 5 ").getTotalSeconds());
	}

	@Test
	public void testParseRejectsMalformedText() {
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("1020"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("ab:cd"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("10:"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse(":10"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("1:2:3"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("-1:10"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("+1:05"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("-0:10"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("1:+5"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("1 2:05"));
	}

	@Test
	public void testLargestPosition() {
		TimePosition t = new TimePosition(35791394, 7);
		assertEquals(Integer.MAX_VALUE, t.getTotalSeconds());
		assertEquals(35791394, t.getMinutes());
		assertEquals(7, t.getSeconds());
		assertEquals(2147483647.0, t.toSeconds(), 0.0);
		assertEquals(t, TimePosition.parse("35791394:07"));
		assertEquals(t, TimePosition.ofSeconds(Integer.MAX_VALUE));
	}

	@Test
	public void testOutOfRangeIsRejected() {
		assertThrows(InvalidTimeException.class, () -> new TimePosition(35791394, 8));
		assertThrows(InvalidTimeException.class, () -> new TimePosition(35791395, 0));
		assertThrows(InvalidTimeException.class, () -> new TimePosition(Integer.MAX_VALUE, 120));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("35791395:00"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("2147483647:120"));
		assertThrows(InvalidTimeException.class, () -> TimePosition.parse("99999999999:00"));
	}

	@Test
	public void testDistantPositionsAreNotEqual() {
		assertNotEquals(new TimePosition(17895697, 0), new TimePosition(0, 0));
		assertNotEquals(TimePosition.parse("35791394:00"), TimePosition.parse("0:00"));
	}

	@Test
	public void testNegativeIsRejected() {
		assertThrows(InvalidTimeException.class, () -> new TimePosition(-1, 0));
		assertThrows(InvalidTimeException.class, () -> new TimePosition(0, -1));
		assertThrows(InvalidTimeException.class, () -> TimePosition.ofSeconds(-5));
	}

	@Test
	public void testAdd() {
		assertEquals("11:10", TimePosition.parse("10:20").add(TimePosition.parse("00:50")).toString());
	}

	@Test
	public void testScale() {
		assertEquals("6:00", TimePosition.parse("02:00").scale(3).toString());
		assertEquals("0:00", TimePosition.parse("02:00").scale(0).toString());
	}

	@Test
	public void testOverflowIsRejected() {
		TimePosition max = TimePosition.ofSeconds(Integer.MAX_VALUE);
		assertThrows(InvalidTimeException.class, () -> max.add(TimePosition.ofSeconds(1)));
		assertThrows(InvalidTimeException.class, () -> TimePosition.ofSeconds(60).scale(Integer.MAX_VALUE));
	}
}
