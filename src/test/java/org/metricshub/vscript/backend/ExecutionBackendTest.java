package org.metricshub.vscript.backend;

import static org.junit.Assert.*;
import static org.metricshub.vscript.backend.BackendTestSupport.plan;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.vscript.util.VScriptSettings;

public class ExecutionBackendTest {

	@Rule
	public TemporaryFolder tempFolder = new TemporaryFolder();

	private VScriptSettings settings;
	private Path out;

	@Before
	public void setUp() throws Exception {
		out = tempFolder.newFolder("out").toPath();
		settings = new VScriptSettings();
		settings.setOutputDirectory(out);
	}

	private List<ProcessInvocation> run(String script) throws Exception {
		RecordingProcessRunner runner = new RecordingProcessRunner();
		assertEquals(0, new ExecutionBackend(settings, runner).execute(plan(script)));
		return runner.getInvocations();
	}

	@Test
	public void testPlay() throws Exception {
		assertEquals(
				Collections.singletonList(new ProcessInvocation("vlc", Arrays.asList("output.mp4"))),
				run("play \"output.mp4\";"));
	}

	@Test
	public void testBoundedPlay() throws Exception {
		assertEquals(
				Collections
						.singletonList(
								new ProcessInvocation(
										"vlc",
										Arrays.asList("v.mp4", "--start-time", "65", "--stop-time", "70"))),
				run("play \"v.mp4\" \"1:05\" 70;"));
	}

	@Test
	public void testFrame() throws Exception {
		List<ProcessInvocation> invocations = run("frame \"video.mp4\" 10 to \"frame10.bmp\";");
		assertEquals(1, invocations.size());
		assertEquals(
				Arrays.asList("ffmpeg", "-y", "-i", "video.mp4", "-vf", "select=eq(n\\,10)", "-vframes", "1", "frame10.bmp"),
				invocations.get(0).getCommand());
	}

	@Test
	public void testAudio() throws Exception {
		List<ProcessInvocation> invocations = run("audio \"video.mp4\" \"00:10\" \"00:20\" to \"audio.mp3\";");
		assertEquals(
				Arrays
						.asList(
								"-y",
								"-ss",
								"0:10",
								"-to",
								"0:20",
								"-i",
								"video.mp4",
								"-vn",
								"-acodec",
								"libmp3lame",
								"audio.mp3"),
				invocations.get(0).getArguments());
	}

	@Test
	public void testConcat() throws Exception {
		List<ProcessInvocation> invocations = run("concat \"clip1.mp4\" \"clip2.mp4\" to \"output.mp4\";");
		assertEquals(3, invocations.size());
		String first = out.resolve("converted_0.mp4").toString();
		String second = out.resolve("converted_1.mp4").toString();
		Path list = out.resolve("files.txt");
		assertEquals(
				Arrays.asList("-y", "-i", "clip1.mp4", "-c:v", "libx264", "-c:a", "aac", first),
				invocations.get(0).getArguments());
		assertEquals(
				Arrays.asList("-y", "-i", "clip2.mp4", "-c:v", "libx264", "-c:a", "aac", second),
				invocations.get(1).getArguments());
		assertEquals(
				Arrays.asList("-y", "-f", "concat", "-safe", "0", "-i", list.toString(), "-c", "copy", "output.mp4"),
				invocations.get(2).getArguments());

		assertTrue(Files.exists(list));
		assertEquals(
				Arrays.asList("file 'converted_0.mp4'", "file 'converted_1.mp4'"),
				Files.readAllLines(list, StandardCharsets.UTF_8));
	}

	@Test
	public void testConcatListIsWrittenOnlyWhenNeeded() throws Exception {
		run("play \"a.mp4\";");
		assertFalse(Files.exists(out.resolve("files.txt")));
	}

	@Test
	public void testConcatCreatesOutputDirectory() throws Exception {
		Path nested = new File(tempFolder.getRoot(), "a/b").toPath();
		settings.setOutputDirectory(nested);
		run("concat \"x.mp4\" \"y.mp4\" to \"z.mp4\";");
		assertTrue(Files.exists(nested.resolve("files.txt")));
	}

	@Test
	public void testStatementOrder() throws Exception {
		List<ProcessInvocation> invocations = run(
				"play \"1.mp4\";\n"
						+ "if \"0:01\" == \"0:02\" then play \"skipped.mp4\";\n"
						+ "let t = \"0:02\";\n"
						+ "if t == \"0:02\" then play \"2.mp4\";\n"
						+ "frame \"3.mp4\" 0 to \"3.bmp\";\n");
		assertEquals(3, invocations.size());
		assertEquals("1.mp4", invocations.get(0).getArguments().get(0));
		assertEquals("2.mp4", invocations.get(1).getArguments().get(0));
		assertEquals("ffmpeg", invocations.get(2).getExecutable());
	}

	@Test
	public void testCustomExecutables() throws Exception {
		settings.setPlayerExecutable("mpv");
		settings.setTranscoderExecutable("/opt/ffmpeg/bin/ffmpeg");
		List<ProcessInvocation> invocations = run("play \"a.mp4\"; frame \"a.mp4\" 1 to \"a.bmp\";");
		assertEquals("mpv", invocations.get(0).getExecutable());
		assertEquals("/opt/ffmpeg/bin/ffmpeg", invocations.get(1).getExecutable());
	}

	@Test
	public void testNonZeroStatusIsCounted() throws Exception {
		RecordingProcessRunner runner = new RecordingProcessRunner(1);
		ExecutionBackend backend = new ExecutionBackend(settings, runner);
		assertEquals(2, backend.execute(plan("play \"a.mp4\"; play \"b.mp4\";")));
		assertEquals(2, runner.getInvocations().size());
	}

	@Test
	public void testDescribe() {
		ExecutionBackend backend = new ExecutionBackend(settings, new RecordingProcessRunner());
		List<String> lines = backend.describe(plan("play \"my clip.mp4\"; frame \"v.mp4\" 2 to \"f.bmp\";"));
		assertEquals(
				Arrays.asList("vlc 'my clip.mp4'", "ffmpeg -y -i v.mp4 -vf select=eq(n\\,2) -vframes 1 f.bmp"),
				lines);
	}

	@Test
	public void testInvocationCommandLine() {
		ProcessInvocation invocation = new ProcessInvocation("vlc", Arrays.asList("it's.mp4", ""));
		assertEquals("vlc 'it'\\''s.mp4' ''", invocation.getCommandLine());
		assertEquals(invocation, new ProcessInvocation("vlc", Arrays.asList("it's.mp4", "")));
		assertNotEquals(invocation, new ProcessInvocation("mpv", Arrays.asList("it's.mp4", "")));
	}

	@Test
	public void testCommandLineQuotesLineBreaks() {
		ProcessInvocation invocation = new ProcessInvocation("vlc", Arrays.asList("a\nb\nc.mp4", "x\ty.mp4", "plain.mp4"));
		assertEquals("vlc 'a\nb\nc.mp4' 'x\ty.mp4' plain.mp4", invocation.getCommandLine());
	}
}
