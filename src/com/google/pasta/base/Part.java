/*
 * Copyright 2026 The Pasta Authors.
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
 * limitations under the License.
 */

package com.google.pasta.base;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * One piece of the source spelling of a formatting slot. A slot is described by a list of parts;
 * the {@link Annotator} consumes each in turn from the {@link TokenStream} and records the
 * concatenated text.
 */
public abstract class Part {

  private Part() {}

  /** Consumes this part from {@code stream} and returns the exact text consumed. */
  abstract String consume(TokenStream stream);

  /** A token with exactly the given text. */
  public static Part token(String text) {
    checkNotNull(text);
    return new Part() {
      @Override
      String consume(TokenStream stream) {
        return stream.token(text);
      }

      @Override
      public String toString() {
        return "'" + text + "'";
      }
    };
  }

  /** The given token if it comes next, together with the whitespace before it. */
  public static Part optional(String text) {
    checkNotNull(text);
    return new Part() {
      @Override
      String consume(TokenStream stream) {
        return stream.optional(text);
      }

      @Override
      public String toString() {
        return "'" + text + "'?";
      }
    };
  }

  private static final Part WHITESPACE =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.whitespace(true);
        }

        @Override
        public String toString() {
          return "ws";
        }
      };

  private static final Part MULTILINE_WHITESPACE =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.whitespace(false);
        }

        @Override
        public String toString() {
          return "ws*";
        }
      };

  private static final Part END_OF_LINE =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.endOfLine();
        }

        @Override
        public String toString() {
          return "eol";
        }
      };

  private static final Part NUMBER =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.number();
        }

        @Override
        public String toString() {
          return "number";
        }
      };

  private static final Part STRING =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.str();
        }

        @Override
        public String toString() {
          return "string";
        }
      };

  private static final Part END_OF_FILE =
      new Part() {
        @Override
        String consume(TokenStream stream) {
          return stream.endOfFile();
        }

        @Override
        public String toString() {
          return "eof";
        }
      };

  /** Whitespace within a logical line. */
  public static Part whitespace() {
    return WHITESPACE;
  }

  /** Whitespace spanning any number of lines, including comments and indentation changes. */
  public static Part multilineWhitespace() {
    return MULTILINE_WHITESPACE;
  }

  public static Part endOfLine() {
    return END_OF_LINE;
  }

  public static Part number() {
    return NUMBER;
  }

  public static Part string() {
    return STRING;
  }

  public static Part endOfFile() {
    return END_OF_FILE;
  }

  public static Part dots(int level) {
    return new Part() {
      @Override
      String consume(TokenStream stream) {
        return stream.dots(level);
      }

      @Override
      public String toString() {
        return "dots(" + level + ")";
      }
    };
  }

  public static Part dottedName(String name) {
    checkNotNull(name);
    return new Part() {
      @Override
      String consume(TokenStream stream) {
        return stream.dottedName(name);
      }

      @Override
      public String toString() {
        return "'" + name + "'";
      }
    };
  }

  /** Comma separated names, as in {@code global} statements. */
  public static Part nameList(List<String> names) {
    ImmutableList<String> copy = ImmutableList.copyOf(names);
    return new Part() {
      @Override
      String consume(TokenStream stream) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < copy.size(); i++) {
          if (i > 0) {
            sb.append(stream.whitespace(true)).append(stream.token(","));
          }
          sb.append(stream.whitespace(true)).append(stream.token(copy.get(i)));
        }
        return sb.toString();
      }

      @Override
      public String toString() {
        return copy.toString();
      }
    };
  }
}
