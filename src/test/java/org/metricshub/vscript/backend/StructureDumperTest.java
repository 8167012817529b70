package org.metricshub.vscript.backend;

import static org.junit.Assert.*;
import static org.metricshub.vscript.backend.BackendTestSupport.parse;

import org.junit.Test;
import org.metricshub.vscript.frontend.Lexer;
import org.metricshub.vscript.frontend.ParseResult;
import org.metricshub.vscript.frontend.Parser;
import org.metricshub.vscript.frontend.ast.ProgramStatement;

public class StructureDumperTest {

	private static String dump(String script) {
		return new StructureDumper().dump(parse(script).getProgram());
	}

	@Test
	public void testLetAndPlay() {
		assertEquals(
				"from anytree import Node\n"
						+ "\n"
						+ "node_0 = Node(\"program\")\n"
						+ "node_1 = Node(\"let\", parent=node_0)\n"
						+ "node_2 = Node(\"var: x\", parent=node_1)\n"
						+ "node_3 = Node(\"expr: a + b\", parent=node_1)\n"
						+ "node_4 = Node(\"play\", parent=node_0)\n"
						+ "node_5 = Node(\"arg1: x\", parent=node_4)\n",
				dump("let x = \"a\" + \"b\"; play x;"));
	}

	@Test
	public void testIfChildComesAfterGuards() {
		assertEquals(
				"from anytree import Node\n"
						+ "\n"
						+ "node_0 = Node(\"program\")\n"
						+ "node_1 = Node(\"if\", parent=node_0)\n"
						+ "node_2 = Node(\"left: 0:10\", parent=node_1)\n"
						+ "node_3 = Node(\"right: 0:20\", parent=node_1)\n"
						+ "node_4 = Node(\"frame\", parent=node_1)\n"
						+ "node_5 = Node(\"arg1: v.mp4\", parent=node_4)\n"
						+ "node_6 = Node(\"arg2: 3\", parent=node_4)\n"
						+ "node_7 = Node(\"dest: f.bmp\", parent=node_4)\n"
						+ "node_8 = Node(\"concat\", parent=node_0)\n"
						+ "node_9 = Node(\"arg1: a.mp4\", parent=node_8)\n"
						+ "node_10 = Node(\"arg2: b.mp4\", parent=node_8)\n"
						+ "node_11 = Node(\"dest: c.mp4\", parent=node_8)\n",
				dump("if \"0:10\" == \"0:20\" then frame \"v.mp4\" 3 to \"f.bmp\";\nconcat \"a.mp4\" \"b.mp4\" to \"c.mp4\";"));
	}

	@Test
	public void testArgumentFields() {
		String audio = dump("audio \"v.mp4\" \"0:10\" 20 to \"a.mp3\";");
		assertTrue(audio.contains("node_2 = Node(\"arg1: v.mp4\", parent=node_1)\n"));
		assertTrue(audio.contains("node_4 = Node(\"arg3: 20\", parent=node_1)\n"));
		assertTrue(audio.endsWith("node_5 = Node(\"dest: a.mp3\", parent=node_1)\n"));

		String play = dump("play \"v.mp4\" \"0:10\" \"0:20\";");
		assertTrue(play.endsWith("node_4 = Node(\"arg3: 0:20\", parent=node_1)\n"));
		assertFalse(dump("play \"v.mp4\";").contains("arg2"));
	}

	@Test
	public void testCounterRestartsForEachDump() {
		StructureDumper dumper = new StructureDumper();
		ProgramStatement program = parse("play \"v.mp4\";").getProgram();
		assertEquals(dumper.dump(program), dumper.dump(program));
	}

	@Test
	public void testErrorNodes() {
		ParseResult result = new Parser().parse(new Lexer().tokenize("play; play \"v.mp4\";").getTokens());
		String dump = new StructureDumper().dump(result.getProgram());
		assertTrue(dump, dump.contains("node_1 = Node(\"ERROR\", parent=node_0)\n"));
		assertTrue(dump, dump.contains("node_2 = Node(\"play\", parent=node_0)\n"));
	}

	@Test
	public void testLabelsAreEscaped() {
		assertTrue(dump("play \"a\\b.mp4\";").contains("Node(\"arg1: a\\\\b.mp4\", parent=node_1)"));
	}
}
