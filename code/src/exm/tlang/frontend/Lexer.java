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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;

import exm.tlang.ast.Token;
import exm.tlang.ast.TokenType;
import exm.tlang.common.Logging;
import exm.tlang.common.exceptions.InvalidTokenException;

/**
 * Converts source text into tokens.
 *
 * At each position the rules are tried in the order declared below and the
 * first one that matches is taken, even if a later rule would match more
 * text.  So keywords come before identifiers, float literals before
 * integers and two-character operators before their one-character
 * prefixes.
 */
public class Lexer {

  private static final Logger logger = Logging.getTLangLogger();

  private static class Rule {
    /** null for text that is discarded */
    final TokenType type;
    final Pattern pattern;

    Rule(TokenType type, String regex) {
      this.type = type;
      this.pattern = Pattern.compile(regex);
    }
  }

  private static Rule skip(String regex) {
    return new Rule(null, regex);
  }

  private static Rule rule(TokenType type, String regex) {
    return new Rule(type, regex);
  }

  private static Rule keyword(TokenType type, String word) {
    return new Rule(type, "\\b" + word + "\\b");
  }

  private static final List<Rule> RULES = ImmutableList.of(
      skip("//.*"),
      skip("\\s+"),

      keyword(IF, "if"),
      keyword(ELSE, "else"),
      keyword(WHILE, "while"),
      keyword(FOR, "for"),
      keyword(STRING, "string"),
      keyword(BOOL, "bool"),
      keyword(CHAR, "char"),
      keyword(FLOAT, "float"),
      keyword(INT, "int"),
      keyword(DEF, "def"),
      keyword(RETURN, "return"),
      keyword(PRINT, "print"),

      rule(STRING_LIT, "\"[^\"]*\""),
      rule(FLOAT_LIT, "\\d+\\.\\d+"),
      rule(BOOL_LIT, "\\b(true|false)\\b"),
      rule(CHAR_LIT, "'[^']'"),
      rule(NUMBER, "\\d+"),

      rule(ID, "[a-zA-Z_][a-zA-Z0-9_]*"),

      rule(EQ, "=="),
      rule(NEQ, "!="),
      rule(GTE, ">="),
      rule(LTE, "<="),
      rule(GT, ">"),
      rule(LT, "<"),
      rule(NOT, "!"),
      rule(ASSIGN, "="),
      rule(PLUS, "\\+"),
      rule(MINUS, "-"),
      rule(MUL, "\\*"),
      rule(DIV, "/"),
      rule(LBRACKET, "\\["),
      rule(RBRACKET, "\\]"),
      rule(LPAREN, "\\("),
      rule(RPAREN, "\\)"),
      rule(LBRACE, "\\{"),
      rule(RBRACE, "\\}"),
      rule(SEMI, ";"),
      rule(COMMA, ","));

  private final String source;

  /** Current offset into source */
  private int pos = 0;
  private int line = 1;
  /** Offset of first character of current line */
  private int lineStart = 0;

  public Lexer(String source) {
    this.source = source;
  }

  /**
   * Tokenize the whole input.
   * @return tokens, always ending with an EOF token
   * @throws InvalidTokenException on the first character no rule matches
   */
  public List<Token> tokenize() throws InvalidTokenException {
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int count = 0;
    while (pos < source.length()) {
      Token tok = nextToken();
      if (tok != null) {
        tokens.add(tok);
        count++;
      }
    }
    tokens.add(new Token(EOF, "", line, pos - lineStart + 1));
    if (logger.isDebugEnabled()) {
      logger.debug("Lexed " + count + " tokens over " + line + " lines");
    }
    return tokens.build();
  }

  /**
   * Match one rule at current position and advance past it
   * @return the token, or null if the text was whitespace or a comment
   * @throws InvalidTokenException
   */
  private Token nextToken() throws InvalidTokenException {
    for (Rule rule: RULES) {
      Matcher m = rule.pattern.matcher(source);
      // Transparent bounds so \b can see the preceding character
      m.region(pos, source.length());
      m.useTransparentBounds(true);
      m.useAnchoringBounds(false);
      if (m.lookingAt() && m.end() > pos) {
        String text = m.group();
        int tokLine = line;
        int tokCol = pos - lineStart + 1;
        advance(m.end());
        if (rule.type == null) {
          return null;
        }
        if (logger.isTraceEnabled()) {
          logger.trace("token " + rule.type + " '" + text + "' at "
                       + tokLine + ":" + tokCol);
        }
        return new Token(rule.type, text, tokLine, tokCol);
      }
    }
    throw new InvalidTokenException(source.codePointAt(pos), line,
                                    pos - lineStart + 1);
  }

  /**
   * Move to end offset, keeping line and column tracking up to date
   */
  private void advance(int end) {
    for (int i = pos; i < end; i++) {
      if (source.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    pos = end;
  }
}
