/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.ipl.parse;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ipl.ast.Pos;

/**
 * Splits the text of a proof script into tokens.
 *
 * <p>There are three kinds of token: left parenthesis, right parenthesis, and
 * symbol. A symbol is a maximal run of characters that are not white space,
 * parentheses or semicolons; "{@code x}", "{@code ->}" and "{@code ⊢}" are all
 * symbols. A semicolon starts a comment that runs to the end of the line.
 */
public class Lexer {
  private final String file;
  private final String text;
  private int index;
  private int line = 1;
  private int column = 1;

  /** Creates a Lexer. */
  public Lexer(String file, String text) {
    this.file = requireNonNull(file);
    this.text = requireNonNull(text);
  }

  /** Scans the whole text. */
  public List<Token> scan() {
    final List<Token> tokens = new ArrayList<>();
    for (;;) {
      skipWhitespaceAndComments();
      if (index >= text.length()) {
        return tokens;
      }
      final int startLine = line;
      final int startColumn = column;
      final char c = text.charAt(index);
      final Kind kind;
      final String s;
      if (c == '(' || c == ')') {
        kind = c == '(' ? Kind.LEFT : Kind.RIGHT;
        s = String.valueOf(c);
        advance();
      } else {
        kind = Kind.SYMBOL;
        final int start = index;
        while (index < text.length() && !isDelimiter(text.charAt(index))) {
          advance();
        }
        s = text.substring(start, index);
      }
      final Pos pos = new Pos(file, startLine, startColumn, line, column);
      tokens.add(new Token(kind, s, pos));
    }
  }

  private static boolean isDelimiter(char c) {
    return c == '(' || c == ')' || c == ';' || Character.isWhitespace(c);
  }

  private void skipWhitespaceAndComments() {
    while (index < text.length()) {
      final char c = text.charAt(index);
      if (c == ';') {
        while (index < text.length() && text.charAt(index) != '\n') {
          advance();
        }
      } else if (Character.isWhitespace(c)) {
        advance();
      } else {
        return;
      }
    }
  }

  private void advance() {
    if (text.charAt(index++) == '\n') {
      ++line;
      column = 1;
    } else {
      ++column;
    }
  }

  /** Kind of token. */
  public enum Kind {
    LEFT,
    RIGHT,
    SYMBOL
  }

  /** A token, with its position in the source text. */
  public static class Token {
    public final Kind kind;
    public final String text;
    public final Pos pos;

    Token(Kind kind, String text, Pos pos) {
      this.kind = requireNonNull(kind);
      this.text = requireNonNull(text);
      this.pos = requireNonNull(pos);
    }

    @Override
    public String toString() {
      return text;
    }
  }
}

// End Lexer.java
