package org.metricshub.vscript.runtime;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * VScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

/**
 * A position (or a duration) inside a clip, in minutes and seconds.
 * <p>
 * Instances are immutable and always normalized: both parts are
 * non-negative and the seconds are lower than 60.
 */
public final class TimePosition {

	private static final int SECONDS_PER_MINUTE = 60;

	private final int minutes;
	private final int seconds;

	/**
	 * Builds a normalized time position. Seconds of 60 or more are carried
	 * over to the minutes.
	 *
	 * @param minutes minutes, must not be negative
	 * @param seconds seconds, must not be negative
	 * @throws InvalidTimeException if either part is negative, or if the
	 *         total number of seconds does not fit in an <code>int</code>
	 */
	public TimePosition(int minutes, int seconds) {
		if (minutes < 0 || seconds < 0) {
			throw new InvalidTimeException("Time cannot be negative: " + minutes + ":" + seconds);
		}
		long total = (long) minutes * SECONDS_PER_MINUTE + seconds;
		if (total > Integer.MAX_VALUE) {
			throw new InvalidTimeException("Time out of range: " + minutes + ":" + seconds);
		}
		this.minutes = (int) (total / SECONDS_PER_MINUTE);
		this.seconds = (int) (total % SECONDS_PER_MINUTE);
	}

	/**
	 * @param totalSeconds number of seconds
	 * @return the normalized position
	 */
	public static TimePosition ofSeconds(int totalSeconds) {
		return new TimePosition(0, totalSeconds);
	}

	/**
	 * Parses a <code>MM:SS</code> literal.
	 *
	 * @param text the literal, without quotes
	 * @return the normalized position
	 * @throws InvalidTimeException if there is no colon, if either part
	 *         is not made of digits only, or if the position is out of range
	 */
	public static TimePosition parse(String text) {
		int colon = text.indexOf(':');
		if (colon < 0) {
			throw new InvalidTimeException("Invalid time format: " + text);
		}
		String min = text.substring(0, colon).trim();
		String sec = text.substring(colon + 1).trim();
		if (!isDigits(min) || !isDigits(sec)) {
			throw new InvalidTimeException("Invalid time format: " + text);
		}
		try {
			return new TimePosition(Integer.parseInt(min), Integer.parseInt(sec));
		} catch (NumberFormatException e) {
			throw new InvalidTimeException("Time out of range: " + text, e);
		}
	}

	private static boolean isDigits(String part) {
		if (part.isEmpty()) {
			return false;
		}
		for (int i = 0; i < part.length(); i++) {
			char c = part.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return true;
	}

	public int getMinutes() {
		return minutes;
	}

	public int getSeconds() {
		return seconds;
	}

	/**
	 * @return the position as a whole number of seconds
	 */
	public int getTotalSeconds() {
		return minutes * SECONDS_PER_MINUTE + seconds;
	}

	/**
	 * @return the position in seconds
	 */
	public double toSeconds() {
		return (double) minutes * SECONDS_PER_MINUTE + seconds;
	}

	/**
	 * @param other position to add
	 * @return the sum of both positions
	 * @throws InvalidTimeException if the sum overflows
	 */
	public TimePosition add(TimePosition other) {
		try {
			return ofSeconds(Math.addExact(getTotalSeconds(), other.getTotalSeconds()));
		} catch (ArithmeticException e) {
			throw new InvalidTimeException("Time out of range: " + this + " + " + other, e);
		}
	}

	/**
	 * @param factor multiplier applied to the total number of seconds
	 * @return the scaled position
	 * @throws InvalidTimeException if the factor is negative, or if the
	 *         result overflows
	 */
	public TimePosition scale(int factor) {
		try {
			return ofSeconds(Math.multiplyExact(getTotalSeconds(), factor));
		} catch (ArithmeticException e) {
			throw new InvalidTimeException("Time out of range: " + this + " * " + factor, e);
		}
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof TimePosition)) {
			return false;
		}
		return getTotalSeconds() == ((TimePosition) obj).getTotalSeconds();
	}

	@Override
	public int hashCode() {
		return getTotalSeconds();
	}

	/**
	 * @return <code>M:SS</code>, seconds padded to two digits
	 */
	@Override
	public String toString() {
		return minutes + ":" + (seconds < 10 ? "0" : "") + seconds;
	}
}
