package org.metricshub.vscript.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.vscript.frontend.ast.AudioStatement;
import org.metricshub.vscript.frontend.ast.ConcatStatement;
import org.metricshub.vscript.frontend.ast.ErrorStatement;
import org.metricshub.vscript.frontend.ast.FrameStatement;
import org.metricshub.vscript.frontend.ast.IfStatement;
import org.metricshub.vscript.frontend.ast.LetStatement;
import org.metricshub.vscript.frontend.ast.PlayStatement;
import org.metricshub.vscript.frontend.ast.Statement;
import org.metricshub.vscript.runtime.TimePosition;
import org.metricshub.vscript.runtime.Value;

public class ParserTest {

	private static ParseResult parse(String script) {
		return parse(script, false);
	}

	private static ParseResult parse(String script, boolean abortOnBindingError) {
		LexResult lex = new Lexer().tokenize(script);
		assertFalse(lex.getErrors().toString(), lex.hasErrors());
		return new Parser(abortOnBindingError).parse(lex.getTokens());
	}

	private static List<ErrorKind> kinds(ParseResult result) {
		List<ErrorKind> kinds = new ArrayList<ErrorKind>();
		for (ScriptError error : result.getErrors()) {
			kinds.add(error.getKind());
		}
		return kinds;
	}

	private static List<Class<?>> classes(ParseResult result) {
		List<Class<?>> classes = new ArrayList<Class<?>>();
		for (Statement statement : result.getProgram().getStatements()) {
			classes.add(statement.getClass());
		}
		return classes;
	}

	@Test
	public void testValidProgram() {
		ParseResult result = parse(
				"frame \"video.mp4\" 10 to \"frame10.bmp\";\n"
						+ "concat \"clip1.mp4\" \"clip2.mp4\" to \"output.mp4\";\n"
						+ "audio \"video.mp4\" \"00:10\" \"00:20\" to \"audio.mp3\";\n"
						+ "play \"output.mp4\";\n");
		assertFalse(result.hasErrors());
		assertFalse(result.isAborted());
		assertEquals(
				Arrays.<Class<?>>asList(FrameStatement.class, ConcatStatement.class, AudioStatement.class, PlayStatement.class),
				classes(result));

		FrameStatement frame = (FrameStatement) result.getProgram().getStatements().get(0);
		assertEquals("video.mp4", frame.getSource().getText());
		assertEquals("10", frame.getFrameIndex().getText());
		assertEquals("frame10.bmp", frame.getDestination());
		assertEquals(1, frame.getLine());

		AudioStatement audio = (AudioStatement) result.getProgram().getStatements().get(2);
		assertEquals("00:10", audio.getStart().getText());
		assertEquals("00:20", audio.getEnd().getText());
		assertEquals(3, audio.getLine());

		assertFalse(((PlayStatement) result.getProgram().getStatements().get(3)).isBounded());
	}

	@Test
	public void testLetBindsWhileParsing() {
		ParseResult result = parse("let x = \"a\" + \"b\"; play x;");
		assertFalse(result.hasErrors());
		assertEquals(Value.string("ab"), result.getEnvironment().lookup("x"));
		LetStatement let = (LetStatement) result.getProgram().getStatements().get(0);
		assertEquals("x", let.getName());
		assertEquals("a + b", let.getExpression().getText());
		PlayStatement play = (PlayStatement) result.getProgram().getStatements().get(1);
		assertEquals("x", play.getSource().getText());
	}

	@Test
	public void testParenthesesAreFlattened() {
		ParseResult result = parse("let t = (\"0:10\" + \"0:05\") * 2;");
		assertFalse(result.hasErrors());
		assertEquals(Value.time(TimePosition.ofSeconds(30)), result.getEnvironment().lookup("t"));
		LetStatement let = (LetStatement) result.getProgram().getStatements().get(0);
		assertEquals("0:10 + 0:05 * 2", let.getExpression().getText());
	}

	@Test
	public void testBoundedPlay() {
		ParseResult result = parse("play \"v.mp4\" \"0:10\" \"0:20\";");
		assertFalse(result.hasErrors());
		PlayStatement play = (PlayStatement) result.getProgram().getStatements().get(0);
		assertTrue(play.isBounded());
		assertEquals("0:10", play.getStart().getText());
		assertEquals("0:20", play.getEnd().getText());
	}

	@Test
	public void testIfWrapsStatement() {
		ParseResult result = parse("if \"0:10\" == \"0:10\" then frame \"v.mp4\" 1 to \"f.bmp\";");
		assertFalse(result.hasErrors());
		IfStatement ifStatement = (IfStatement) result.getProgram().getStatements().get(0);
		assertTrue(ifStatement.getThenStatement() instanceof FrameStatement);
		assertEquals(Collections.singletonList(ifStatement.getThenStatement()), ifStatement.getChildren());
	}

	@Test
	public void testMissingSemicolonRecovery() {
		ParseResult result = parse("let x = \"a\" if x == \"a\" then play \"v.mp4\";");
		assertEquals(Arrays.asList(ErrorKind.UNEXPECTED_TOKEN), kinds(result));
		ScriptError error = result.getErrors().get(0);
		assertEquals("Error at line 1, col 13: UnexpectedToken - Expected SEMICOLON, got if", error.format());
		assertEquals(Arrays.<Class<?>>asList(ErrorStatement.class, IfStatement.class), classes(result));
		IfStatement ifStatement = (IfStatement) result.getProgram().getStatements().get(1);
		assertTrue(ifStatement.getThenStatement() instanceof PlayStatement);
		assertSame(error, ((ErrorStatement) result.getProgram().getStatements().get(0)).getError());
	}

	@Test
	public void testMissingSemicolonBeforeCommand() {
		ParseResult result = parse("\nlet start = \"00:10\"\nframe \"video.mp4\" 5 to \"frame5.bmp\";\nplay \"video.mp4\";\n");
		assertEquals(Arrays.asList(ErrorKind.UNEXPECTED_TOKEN), kinds(result));
		assertEquals(3, result.getErrors().get(0).getLine());
		assertEquals(
				Arrays.<Class<?>>asList(ErrorStatement.class, FrameStatement.class, PlayStatement.class),
				classes(result));
	}

	@Test
	public void testInvalidStatementRecovery() {
		ParseResult result = parse(
				"let file = \"video\";\n"
						+ "invalid \"video.mp4\"; # Unknown command\n"
						+ "concat file + \".mp4\" \"clip2.mp4\" to \"output.mp4\";\n");
		assertEquals(Arrays.asList(ErrorKind.INVALID_STATEMENT), kinds(result));
		assertEquals(2, result.getErrors().get(0).getLine());
		assertEquals(
				Arrays.<Class<?>>asList(LetStatement.class, ErrorStatement.class, ConcatStatement.class),
				classes(result));
		ConcatStatement concat = (ConcatStatement) result.getProgram().getStatements().get(2);
		assertEquals("video + .mp4", concat.getFirst().getText());
	}

	@Test
	public void testInvalidExpressionRecovery() {
		ParseResult result = parse(
				"let duration = \"00:05\";\n"
						+ "audio \"video.mp4\" duration + + \"00:10\" to \"audio.mp3\"; # Invalid expression\n"
						+ "if duration == \"00:05\" then play \"video.mp4\";\n");
		assertEquals(Arrays.asList(ErrorKind.INVALID_EXPRESSION), kinds(result));
		assertEquals(2, result.getErrors().get(0).getLine());
		assertEquals(30, result.getErrors().get(0).getColumn());
		assertEquals(
				Arrays.<Class<?>>asList(LetStatement.class, ErrorStatement.class, IfStatement.class),
				classes(result));
	}

	@Test
	public void testUnknownCommand() {
		List<Token> tokens = Arrays
				.asList(
						new Token(TokenType.KEYWORD, "rotate", 1, 1),
						new Token(TokenType.STRING, "v.mp4", 1, 8),
						new Token(TokenType.SEMICOLON, ";", 1, 15),
						new Token(TokenType.KEYWORD, "play", 2, 1),
						new Token(TokenType.STRING, "v.mp4", 2, 6),
						new Token(TokenType.SEMICOLON, ";", 2, 13),
						new Token(TokenType.END_OF_PROGRAM, "", 2, 14));
		ParseResult result = new Parser().parse(tokens);
		assertEquals(Arrays.asList(ErrorKind.UNKNOWN_COMMAND), kinds(result));
		assertEquals("Unknown command: rotate", result.getErrors().get(0).getMessage());
		assertEquals(Arrays.<Class<?>>asList(ErrorStatement.class, PlayStatement.class), classes(result));
	}

	@Test
	public void testMissingDestination() {
		ParseResult result = parse("frame \"v.mp4\" 1 \"x.bmp\";");
		assertEquals(Arrays.asList(ErrorKind.UNEXPECTED_TOKEN), kinds(result));
		assertEquals("Expected TO, got x.bmp", result.getErrors().get(0).getMessage());
	}

	@Test
	public void testTruncatedProgram() {
		ParseResult result = parse("play");
		assertEquals(Arrays.asList(ErrorKind.INVALID_EXPRESSION), kinds(result));
		assertEquals(1, result.getProgram().getStatements().size());

		result = parse("play \"v.mp4\"");
		assertEquals(Arrays.asList(ErrorKind.INVALID_EXPRESSION), kinds(result));

		result = parse("let x = \"a\"");
		assertEquals("Expected SEMICOLON, got end of program", result.getErrors().get(0).getMessage());
	}

	@Test
	public void testBindingErrorIsRecoverable() {
		ParseResult result = parse("let x = y; play \"a\";");
		assertEquals(Arrays.asList(ErrorKind.UNKNOWN_IDENTIFIER), kinds(result));
		assertFalse(result.isAborted());
		assertEquals(Arrays.<Class<?>>asList(ErrorStatement.class, PlayStatement.class), classes(result));
		assertFalse(result.getEnvironment().isBound("x"));

		result = parse("let t = \"0:10\" + 1; let u = \"0:10\";");
		assertEquals(Arrays.asList(ErrorKind.TYPE_ERROR), kinds(result));
		assertTrue(result.getEnvironment().isBound("u"));
	}

	@Test
	public void testBindingErrorAbortsWhenRequested() {
		ParseResult result = parse("let x = y; frame \"a\" to \"b.bmp\"; play \"a\";", true);
		assertTrue(result.isAborted());
		assertEquals(Arrays.asList(ErrorKind.UNKNOWN_IDENTIFIER), kinds(result));
		assertTrue(result.getProgram().getStatements().isEmpty());
		assertEquals(1, result.getErrors().get(0).getLine());
		assertEquals(9, result.getErrors().get(0).getColumn());
	}

	@Test
	public void testLaterBindingIsNotVisibleEarlier() {
		ParseResult result = parse("let a = b; let b = \"x\";");
		assertEquals(Arrays.asList(ErrorKind.UNKNOWN_IDENTIFIER), kinds(result));
		assertEquals(Value.string("x"), result.getEnvironment().lookup("b"));
	}

	@Test
	public void testDollarEndsProgram() {
		ParseResult result = parse("play \"a\"; $ play \"b\";");
		assertFalse(result.hasErrors());
		assertEquals(1, result.getProgram().getStatements().size());
	}

	@Test
	public void testTokenListMustBeTerminated() {
		assertThrows(IllegalArgumentException.class, () -> new Parser().parse(Collections.<Token>emptyList()));
		assertThrows(
				IllegalArgumentException.class,
				() -> new Parser().parse(Collections.singletonList(new Token(TokenType.SEMICOLON, ";", 1, 1))));
	}
}
