/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tlang.frontend;

import static exm.tlang.ast.TokenType.*;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.tlang.ast.Token;
import exm.tlang.ast.TokenType;
import exm.tlang.common.exceptions.InvalidTokenException;

public class LexerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static List<TokenType> types(List<Token> tokens) {
    List<TokenType> result = new ArrayList<TokenType>();
    for (Token tok: tokens) {
      result.add(tok.getType());
    }
    return result;
  }

  private static List<Token> lex(String source) throws InvalidTokenException {
    return new Lexer(source).tokenize();
  }

  @Test
  public void testDeclaration() throws Exception {
    List<Token> tokens = lex("int x = 10;");
    assertEquals(Arrays.asList(INT, ID, ASSIGN, NUMBER, SEMI, EOF),
                 types(tokens));
    assertEquals("x", tokens.get(1).getText());
    assertEquals("10", tokens.get(3).getText());
    assertEquals("Column of number", 9, tokens.get(3).getColumn());
  }

  @Test
  public void testKeywordsNeedWordBoundary() throws Exception {
    List<Token> tokens = lex("integer intx int print_it print");
    assertEquals(Arrays.asList(ID, ID, INT, ID, PRINT, EOF), types(tokens));
    assertEquals("integer", tokens.get(0).getText());
  }

  @Test
  public void testBoolLiterals() throws Exception {
    List<Token> tokens = lex("true false trueish");
    assertEquals(Arrays.asList(BOOL_LIT, BOOL_LIT, ID, EOF), types(tokens));
  }

  @Test
  public void testNumbers() throws Exception {
    List<Token> tokens = lex("3.14 42");
    assertEquals(Arrays.asList(FLOAT_LIT, NUMBER, EOF), types(tokens));
    assertEquals("3.14", tokens.get(0).getText());
  }

  @Test
  public void testOperatorsLongestFirst() throws Exception {
    assertEquals(Arrays.asList(EQ, NEQ, GTE, LTE, GT, LT, NOT, ASSIGN, EOF),
                 types(lex("== != >= <= > < ! =")));
    assertEquals(Arrays.asList(ID, LTE, ID, EOF), types(lex("a<=b")));
    assertEquals(Arrays.asList(PLUS, MINUS, MUL, DIV, LBRACKET, RBRACKET,
                   LPAREN, RPAREN, LBRACE, RBRACE, SEMI, COMMA, EOF),
                 types(lex("+-*/[](){};,")));
  }

  @Test
  public void testLiteralsKeepSourceText() throws Exception {
    List<Token> tokens = lex("\"hi // there\" 'c'");
    assertEquals(Arrays.asList(STRING_LIT, CHAR_LIT, EOF), types(tokens));
    assertEquals("Comment marker inside string is kept",
                 "\"hi // there\"", tokens.get(0).getText());
    assertEquals("'c'", tokens.get(1).getText());
  }

  @Test
  public void testCommentsAndPositions() throws Exception {
    List<Token> tokens = lex("int a = 1; // comment ; ;\n  print(a);");
    assertEquals(Arrays.asList(INT, ID, ASSIGN, NUMBER, SEMI,
                               PRINT, LPAREN, ID, RPAREN, SEMI, EOF),
                 types(tokens));
    Token print = tokens.get(5);
    assertEquals(2, print.getLine());
    assertEquals(3, print.getColumn());
  }

  @Test
  public void testMultilineStringCountsLines() throws Exception {
    List<Token> tokens = lex("\"a\nb\" x");
    assertEquals(2, tokens.get(1).getLine());
    assertEquals("EOF on last line", 2, tokens.get(2).getLine());
  }

  @Test
  public void testEmptySource() throws Exception {
    assertEquals(Arrays.asList(EOF), types(lex("")));
    assertEquals(Arrays.asList(EOF), types(lex("  // only a comment\n")));
  }

  @Test
  public void testInvalidCharacter() throws Exception {
    exception.expect(InvalidTokenException.class);
    exception.expectMessage("LexError: Unexpected character: '@' at line 1:11");
    lex("int x = 5 @ 3;");
  }

  @Test
  public void testInvalidCharacterPosition() throws Exception {
    try {
      lex("int x = 1;\nx = #;");
      fail("Expected lex error");
    } catch (InvalidTokenException e) {
      assertEquals(5, e.getColumn());
      assertEquals("Unexpected character: '#' at line 2:5", e.getDetail());
    }
  }

  @Test
  public void testCharLiteralOutsideBmp() throws Exception {
    List<Token> tokens = lex("char c = '\uD83D\uDE00';");
    assertEquals(Arrays.asList(CHAR, ID, ASSIGN, CHAR_LIT, SEMI, EOF),
                 types(tokens));
    assertEquals("'\uD83D\uDE00'", tokens.get(3).getText());
  }

  @Test
  public void testInvalidCharacterOutsideBmp() throws Exception {
    exception.expect(InvalidTokenException.class);
    exception.expectMessage("Unexpected character: '\uD83D\uDE00' at line 1:9");
    lex("int x = \uD83D\uDE00;");
  }

  @Test
  public void testTrailingDotIsInvalid() throws Exception {
    exception.expect(InvalidTokenException.class);
    lex("float f = 3.;");
  }
}
