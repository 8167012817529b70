package org.metricshub.vscript.frontend;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class LexerTest {

	private static LexResult lex(String text) {
		return new Lexer().tokenize(text);
	}

	private static List<TokenType> types(LexResult result) {
		List<TokenType> types = new ArrayList<TokenType>();
		for (Token token : result.getTokens()) {
			types.add(token.getType());
		}
		return types;
	}

	private static List<ErrorKind> kinds(LexResult result) {
		List<ErrorKind> kinds = new ArrayList<ErrorKind>();
		for (ScriptError error : result.getErrors()) {
			kinds.add(error.getKind());
		}
		return kinds;
	}

	@Test
	public void testFrameStatement() {
		LexResult result = lex("frame \"video.mp4\" 10 to \"frame10.bmp\";");
		assertFalse(result.hasErrors());
		assertEquals(
				Arrays
						.asList(
								new Token(TokenType.KEYWORD, "frame", 1, 1),
								new Token(TokenType.STRING, "video.mp4", 1, 7),
								new Token(TokenType.INT, "10", 1, 19),
								new Token(TokenType.TO, "to", 1, 22),
								new Token(TokenType.STRING, "frame10.bmp", 1, 25),
								new Token(TokenType.SEMICOLON, ";", 1, 38),
								new Token(TokenType.END_OF_PROGRAM, "", 1, 39)),
				result.getTokens());
	}

	@Test
	public void testReservedWords() {
		LexResult result = lex("let if then to print frame concat audio play name Play2");
		assertEquals(
				Arrays
						.asList(
								TokenType.LET,
								TokenType.IF,
								TokenType.THEN,
								TokenType.TO,
								TokenType.PRINT,
								TokenType.KEYWORD,
								TokenType.KEYWORD,
								TokenType.KEYWORD,
								TokenType.KEYWORD,
								TokenType.IDENTIFIER,
								TokenType.IDENTIFIER,
								TokenType.END_OF_PROGRAM),
				types(result));
	}

	@Test
	public void testOperators() {
		LexResult result = lex("= == + * ( ) ; $");
		assertEquals(
				Arrays
						.asList(
								TokenType.ASSIGN,
								TokenType.EQUALS,
								TokenType.ADD,
								TokenType.MULTIPLY,
								TokenType.OPEN_PAREN,
								TokenType.CLOSE_PAREN,
								TokenType.SEMICOLON,
								TokenType.END_OF_PROGRAM,
								TokenType.END_OF_PROGRAM),
				types(result));
		assertEquals("==", result.getTokens().get(1).getText());
		assertEquals("$", result.getTokens().get(7).getText());
	}

	@Test
	public void testTimeLiteral() {
		LexResult result = lex("\"00:10\" \"video\"");
		assertFalse(result.hasErrors());
		assertEquals(new Token(TokenType.TIME, "00:10", 1, 1), result.getTokens().get(0));
		assertEquals(new Token(TokenType.STRING, "video", 1, 9), result.getTokens().get(1));
	}

	@Test
	public void testComments() {
		LexResult result = lex("# line comment\nplay \"a\"; ## block\nstill comment ##\nplay \"b\";");
		assertFalse(result.hasErrors());
		assertEquals(7, result.getTokens().size());
		assertEquals(2, result.getTokens().get(0).getLine());
		Token secondPlay = result.getTokens().get(3);
		assertEquals("play", secondPlay.getText());
		assertEquals(4, secondPlay.getLine());
		assertEquals(1, secondPlay.getColumn());
	}

	@Test
	public void testUnterminatedComment() {
		LexResult result = lex("play \"a\"; ## never closed\nplay \"b\";");
		assertEquals(Arrays.asList(ErrorKind.UNTERMINATED_COMMENT), kinds(result));
		ScriptError error = result.getErrors().get(0);
		assertEquals(1, error.getLine());
		assertEquals(11, error.getColumn());
		assertEquals(4, result.getTokens().size());
	}

	@Test
	public void testUnclosedString() {
		LexResult result = lex("play \"abc\n;");
		assertEquals(Arrays.asList(ErrorKind.UNCLOSED_STRING), kinds(result));
		assertEquals(1, result.getErrors().get(0).getLine());
		assertEquals(6, result.getErrors().get(0).getColumn());
		assertEquals(Arrays.asList(TokenType.KEYWORD, TokenType.END_OF_PROGRAM), types(result));
	}

	@Test
	public void testEmptyString() {
		LexResult result = lex("play \"\";");
		assertEquals(Arrays.asList(ErrorKind.EMPTY_STRING), kinds(result));
		assertEquals(Arrays.asList(TokenType.KEYWORD, TokenType.SEMICOLON, TokenType.END_OF_PROGRAM), types(result));
	}

	@Test
	public void testInvalidTime() {
		LexResult result = lex("\"1:xx\" \"5:-3\"");
		assertEquals(Arrays.asList(ErrorKind.INVALID_TIME, ErrorKind.INVALID_TIME), kinds(result));
		assertEquals("Invalid time format: 1:xx", result.getErrors().get(0).getMessage());
	}

	@Test
	public void testTimeLiteralRange() {
		LexResult result = lex("\"35791394:07\" \"35791395:00\" \"2147483647:120\"");
		assertEquals(Arrays.asList(ErrorKind.INVALID_TIME, ErrorKind.INVALID_TIME), kinds(result));
		assertEquals(Arrays.asList(TokenType.TIME, TokenType.END_OF_PROGRAM), types(result));
		assertEquals(15, result.getErrors().get(0).getColumn());
		assertEquals(29, result.getErrors().get(1).getColumn());
	}

	@Test
	public void testSignedTimeLiteral() {
		LexResult result = lex("\"+1:05\" \"-0:10\"");
		assertEquals(Arrays.asList(ErrorKind.INVALID_TIME, ErrorKind.INVALID_TIME), kinds(result));
		assertEquals("Invalid time format: +1:05", result.getErrors().get(0).getMessage());
	}

	@Test
	public void testInvalidNumber() {
		LexResult result = lex("frame \"v.mp4\" 99999999999 to \"f.bmp\";");
		assertEquals(Arrays.asList(ErrorKind.INVALID_NUMBER), kinds(result));
		assertEquals(15, result.getErrors().get(0).getColumn());
	}

	@Test
	public void testInvalidCharacterDoesNotStopTheScan() {
		LexResult result = lex("play @ \"a\";\n  ~");
		assertEquals(Arrays.asList(ErrorKind.INVALID_CHARACTER, ErrorKind.INVALID_CHARACTER), kinds(result));
		assertEquals(
				"Error at line 1, col 6: InvalidCharacter - Unexpected character: @",
				result.getErrors().get(0).format());
		assertEquals(2, result.getErrors().get(1).getLine());
		assertEquals(3, result.getErrors().get(1).getColumn());
		assertEquals(
				Arrays.asList(TokenType.KEYWORD, TokenType.STRING, TokenType.SEMICOLON, TokenType.END_OF_PROGRAM),
				types(result));
	}

	@Test
	public void testErrorsAreCollectedInOrder() {
		LexResult result = lex("@ \"\" \"1:x\" ## open");
		assertEquals(
				Arrays
						.asList(
								ErrorKind.INVALID_CHARACTER,
								ErrorKind.EMPTY_STRING,
								ErrorKind.INVALID_TIME,
								ErrorKind.UNTERMINATED_COMMENT),
				kinds(result));
	}

	@Test
	public void testEmptyScript() {
		LexResult result = lex("  \n\t ");
		assertFalse(result.hasErrors());
		assertEquals(1, result.getTokens().size());
		Token end = result.getTokens().get(0);
		assertTrue(end.is(TokenType.END_OF_PROGRAM));
		assertEquals(2, end.getLine());
		assertEquals(3, end.getColumn());
	}
}
