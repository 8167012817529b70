package org.metricshub.vscript.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class VScriptLoggerTest {

	@Test
	public void testPosition() {
		assertEquals("line 3, col 7", VScriptLogger.at(3, 7).toString());
	}

	@Test
	public void testLoggerIsNamedAfterClass() {
		assertEquals(VScriptLoggerTest.class.getName(), VScriptLogger.getLogger(VScriptLoggerTest.class).getName());
	}
}
