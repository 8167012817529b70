package org.metricshub.vscript.backend;

import static org.junit.Assert.*;
import static org.metricshub.vscript.backend.BackendTestSupport.plan;

import java.util.List;
import org.junit.Test;
import org.metricshub.vscript.backend.action.MediaAction;
import org.metricshub.vscript.util.VScriptSettings;

public class ScriptTranslatorTest {

	private static final VScriptSettings SETTINGS = new VScriptSettings();

	private static String translate(String script) {
		return new ScriptTranslator(SETTINGS).translate(plan(script));
	}

	@Test
	public void testEmptyProgram() {
		assertEquals("import ffmpeg\nimport subprocess\n\n", translate(""));
	}

	@Test
	public void testBlocks() {
		String python = translate(
				"frame \"video.mp4\" 10 to \"frame10.bmp\";\n"
						+ "audio \"video.mp4\" \"00:10\" \"00:20\" to \"audio.mp3\";\n"
						+ "play \"output.mp4\";\n"
						+ "play \"output.mp4\" 5 \"0:09\";\n");
		assertEquals(
				"import ffmpeg\n"
						+ "import subprocess\n"
						+ "\n"
						+ "ffmpeg.input(\"video.mp4\").filter(\"select\", \"eq(n\\\\,10)\")"
						+ ".output(\"frame10.bmp\", vframes=1).run(overwrite_output=True)\n"
						+ "\n"
						+ "ffmpeg.input(\"video.mp4\", ss=\"0:10\", to=\"0:20\")"
						+ ".output(\"audio.mp3\", vn=None, acodec='libmp3lame').run(overwrite_output=True)\n"
						+ "\n"
						+ "subprocess.run([\"vlc\", \"output.mp4\"])\n"
						+ "\n"
						+ "subprocess.run([\"vlc\", \"output.mp4\", \"--start-time\", \"5\", \"--stop-time\", \"9\"])\n"
						+ "\n",
				python);
	}

	@Test
	public void testConcatBlock() {
		String python = translate("concat \"clip1.mp4\" \"clip2.mp4\" to \"output.mp4\";");
		assertEquals(
				"import ffmpeg\n"
						+ "import subprocess\n"
						+ "\n"
						+ "# Convert inputs\n"
						+ "ffmpeg.input(\"clip1.mp4\").output(\"converted_0.mp4\", vcodec='libx264', acodec='aac')"
						+ ".run(overwrite_output=True)\n"
						+ "ffmpeg.input(\"clip2.mp4\").output(\"converted_1.mp4\", vcodec='libx264', acodec='aac')"
						+ ".run(overwrite_output=True)\n"
						+ "\n"
						+ "# Write concat file list\n"
						+ "with open(\"files.txt\", 'w') as f:\n"
						+ "    f.write(\"file 'converted_0.mp4'\\n\")\n"
						+ "    f.write(\"file 'converted_1.mp4'\\n\")\n"
						+ "\n"
						+ "# Concatenate with concat demuxer\n"
						+ "subprocess.run([\"ffmpeg\", \"-y\", \"-f\", \"concat\", \"-safe\", \"0\", \"-i\", \"files.txt\","
						+ " \"-c\", \"copy\", \"output.mp4\"])\n"
						+ "\n",
				python);
	}

	@Test
	public void testLineBreaksStayInsideComments() {
		String python = translate(
				"let x = \"a\nimport os\";\n"
						+ "play x;\n"
						+ "if \"0:\n10\" == \"0:20\" then play x;\n");
		assertEquals(
				"import ffmpeg\n"
						+ "import subprocess\n"
						+ "\n"
						+ "# let x = a\\nimport os\n"
						+ "\n"
						+ "subprocess.run([\"vlc\", \"a\\nimport os\"])\n"
						+ "\n"
						+ "# skipped: if 0:\\n10 == 0:20\n"
						+ "\n",
				python);
		for (String line : python.split("\n")) {
			assertFalse(line, line.startsWith("import os") || line.startsWith("10 "));
		}
	}

	@Test
	public void testStatementsWithoutAction() {
		String python = translate(
				"let x = \"a\" + \"b\";\n"
						+ "if \"0:10\" == \"0:20\" then play x;\n"
						+ "if \"0:10\" == \"0:10\" then play x;\n");
		assertEquals(
				"import ffmpeg\n"
						+ "import subprocess\n"
						+ "\n"
						+ "# let x = a + b\n"
						+ "\n"
						+ "# skipped: if 0:10 == 0:20\n"
						+ "\n"
						+ "# if 0:10 == 0:10\n"
						+ "subprocess.run([\"vlc\", \"ab\"])\n"
						+ "\n",
				python);
	}

	@Test
	public void testEscaping() {
		String python = translate("play \"clips\\old.mp4\";");
		assertTrue(python, python.contains("subprocess.run([\"vlc\", \"clips\\\\old.mp4\"])"));
		assertEquals("\"a\\\"b\\n\"", PythonLiterals.quote("a\"b\n"));
	}

	@Test
	public void testSameArgumentsAsExecution() {
		ExecutionPlan plan = plan(
				"let name = \"clip\";\n"
						+ "let start = \"0:30\";\n"
						+ "frame name + \".mp4\" 7 to \"f.bmp\";\n"
						+ "audio name + \".mp4\" start start * 2 to \"a.mp3\";\n"
						+ "play name + \".mkv\" start start + \"0:15\";\n"
						+ "concat name + \"1.mp4\" name + \"2.mp4\" to \"all.mp4\";\n");
		ExecutionBackend backend = new ExecutionBackend(SETTINGS, new RecordingProcessRunner());
		ScriptTranslator translator = new ScriptTranslator(SETTINGS);
		String python = translator.translate(plan);

		List<MediaAction> actions = plan.getActions();
		assertEquals(4, actions.size());

		// frame: source, filter and destination
		List<String> frame = backend.invocationsFor(actions.get(0)).get(0).getArguments();
		assertTrue(python.contains("ffmpeg.input(" + PythonLiterals.quote(frame.get(2)) + ")"));
		assertTrue(python.contains("\"select\", " + PythonLiterals.quote(frame.get(4).substring("select=".length()))));
		assertTrue(python.contains(".output(" + PythonLiterals.quote(frame.get(7)) + ", vframes=1)"));

		// audio: bounds, source and destination
		List<String> audio = backend.invocationsFor(actions.get(1)).get(0).getArguments();
		assertTrue(
				python,
				python
						.contains(
								"ffmpeg.input(" + PythonLiterals.quote(audio.get(6))
										+ ", ss=" + PythonLiterals.quote(audio.get(2))
										+ ", to=" + PythonLiterals.quote(audio.get(4)) + ")"
										+ ".output(" + PythonLiterals.quote(audio.get(10))));

		// play: the whole command line
		ProcessInvocation play = backend.invocationsFor(actions.get(2)).get(0);
		assertTrue(python, python.contains("subprocess.run(" + PythonLiterals.list(play.getCommand()) + ")"));

		// concat: both sources and the destination
		List<ProcessInvocation> concat = backend.invocationsFor(actions.get(3));
		assertTrue(python.contains("ffmpeg.input(" + PythonLiterals.quote(concat.get(0).getArguments().get(2)) + ")"));
		assertTrue(python.contains("ffmpeg.input(" + PythonLiterals.quote(concat.get(1).getArguments().get(2)) + ")"));
		List<String> join = concat.get(2).getArguments();
		assertTrue(python.contains(PythonLiterals.quote(join.get(join.size() - 1)) + "])"));
	}
}
