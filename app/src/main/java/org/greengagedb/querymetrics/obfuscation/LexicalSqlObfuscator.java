/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.greengagedb.querymetrics.obfuscation;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.util.TablesNamesFinder;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-level SQL obfuscator.
 *
 * <p>Replaces every literal (quoted and escaped strings, dollar-quoted bodies, numbers and
 * {@code $n} parameters) with {@code ?}, strips comments and collapses whitespace. Parenthesized
 * placeholder lists such as {@code IN (?, ?, ?)} collapse to {@code (?)} so that queries
 * differing only in list length share a signature.
 *
 * <p>Commands are the command keywords found anywhere in the statement outside literals,
 * quoted identifiers and comments, in order of first appearance, so {@code INSERT ... SELECT}
 * reports both and a join reports {@code JOIN}.
 *
 * <p>Table names are extracted with JSqlParser from the obfuscated text. Statements
 * JSqlParser cannot handle still obfuscate; they just carry no table metadata.
 */
@Slf4j
@ApplicationScoped
public class LexicalSqlObfuscator implements SqlObfuscator {

    private static final Set<String> COMMANDS = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "MERGE", "JOIN",
            "CREATE", "ALTER", "DROP", "TRUNCATE", "GRANT", "REVOKE",
            "BEGIN", "COMMIT", "ROLLBACK", "COPY", "CALL", "EXECUTE", "VACUUM"
    );
    private static final Pattern PLACEHOLDER_LIST = Pattern.compile("\\(\\s*\\?(\\s*,\\s*\\?)+\\s*\\)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    @Override
    public ObfuscatedStatement obfuscate(String sql, ObfuscatorOptions options) throws ObfuscationException {
        if (sql == null || sql.isBlank()) {
            throw new ObfuscationException("Empty SQL text");
        }
        Lexer lexer = new Lexer(sql, options);
        lexer.run();

        String query = PLACEHOLDER_LIST.matcher(lexer.output.toString().trim()).replaceAll("(?)");
        if (query.isEmpty()) {
            throw new ObfuscationException("SQL text contains no statement");
        }

        String tablesCsv = options.collectTables() ? String.join(",", extractTables(query)) : "";
        List<String> commands = options.collectCommands() ? new ArrayList<>(lexer.commands) : List.of();
        List<String> comments = options.collectComments() ? lexer.comments : List.of();
        return new ObfuscatedStatement(query, new StatementMetadata(tablesCsv, commands, comments));
    }

    private Set<String> extractTables(String query) {
        try {
            Statement statement = CCJSqlParserUtil.parse(query);
            return new LinkedHashSet<>(new TablesNamesFinder().getTableList(statement));
        } catch (JSQLParserException | RuntimeException e) {
            log.trace("No table metadata for '{}': {}", query, e.getMessage());
            return Set.of();
        }
    }

    private static final class Lexer {
        private final String sql;
        private final ObfuscatorOptions options;
        private final StringBuilder output = new StringBuilder();
        private final Set<String> commands = new LinkedHashSet<>();
        private final List<String> comments = new ArrayList<>();
        private int pos;

        Lexer(String sql, ObfuscatorOptions options) {
            this.sql = sql;
            this.options = options;
        }

        void run() throws ObfuscationException {
            int length = sql.length();
            while (pos < length) {
                char c = sql.charAt(pos);
                if (Character.isWhitespace(c)) {
                    appendSpace();
                    pos++;
                } else if (c == '-' && peek(1) == '-') {
                    lineComment();
                } else if (c == '/' && peek(1) == '*') {
                    blockComment();
                } else if (c == '\'') {
                    stringLiteral(false);
                } else if (isStringPrefix(c) && peek(1) == '\'') {
                    pos++;
                    stringLiteral(c == 'E' || c == 'e');
                } else if (c == '"') {
                    quotedIdentifier();
                } else if (c == '$') {
                    dollar();
                } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(1)))) {
                    number();
                } else if (Character.isLetter(c) || c == '_') {
                    identifier();
                } else {
                    output.append(c);
                    pos++;
                }
            }
        }

        private char peek(int offset) {
            int index = pos + offset;
            return index < sql.length() ? sql.charAt(index) : '\0';
        }

        private void appendSpace() {
            int last = output.length() - 1;
            if (last >= 0 && output.charAt(last) != ' ') {
                output.append(' ');
            }
        }

        private void lineComment() {
            int end = sql.indexOf('\n', pos);
            if (end < 0) {
                end = sql.length();
            }
            comments.add(sql.substring(pos, end).trim());
            pos = end;
            appendSpace();
        }

        private void blockComment() throws ObfuscationException {
            int start = pos;
            int depth = 1;
            pos += 2;
            while (pos < sql.length() && depth > 0) {
                if (sql.startsWith("/*", pos)) {
                    depth++;
                    pos += 2;
                } else if (sql.startsWith("*/", pos)) {
                    depth--;
                    pos += 2;
                } else {
                    pos++;
                }
            }
            if (depth > 0) {
                throw new ObfuscationException("Unterminated block comment");
            }
            comments.add(sql.substring(start, pos));
            appendSpace();
        }

        private void stringLiteral(boolean backslashEscapes) throws ObfuscationException {
            pos++;
            while (true) {
                if (pos >= sql.length()) {
                    throw new ObfuscationException("Unterminated string literal");
                }
                char c = sql.charAt(pos);
                if (backslashEscapes && c == '\\') {
                    pos += 2;
                } else if (c == '\'') {
                    if (peek(1) == '\'') {
                        pos += 2;
                    } else {
                        pos++;
                        break;
                    }
                } else {
                    pos++;
                }
            }
            output.append('?');
        }

        private void quotedIdentifier() throws ObfuscationException {
            int start = pos;
            pos++;
            while (true) {
                if (pos >= sql.length()) {
                    throw new ObfuscationException("Unterminated quoted identifier");
                }
                if (sql.charAt(pos) == '"') {
                    if (peek(1) == '"') {
                        pos += 2;
                        continue;
                    }
                    pos++;
                    break;
                }
                pos++;
            }
            output.append(sql, start, pos);
        }

        private void dollar() throws ObfuscationException {
            if (Character.isDigit(peek(1))) {
                pos++;
                while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) {
                    pos++;
                }
                output.append('?');
                return;
            }
            int tagEnd = pos + 1;
            while (tagEnd < sql.length() && isTagPart(sql.charAt(tagEnd))) {
                tagEnd++;
            }
            if (tagEnd >= sql.length() || sql.charAt(tagEnd) != '$') {
                output.append('$');
                pos++;
                return;
            }
            String tag = sql.substring(pos, tagEnd + 1);
            int closing = sql.indexOf(tag, tagEnd + 1);
            if (closing < 0) {
                throw new ObfuscationException("Unterminated dollar-quoted string");
            }
            pos = closing + tag.length();
            output.append('?');
        }

        private void number() {
            while (pos < sql.length() && (Character.isDigit(sql.charAt(pos)) || sql.charAt(pos) == '.')) {
                pos++;
            }
            if ((peek(0) == 'e' || peek(0) == 'E')
                    && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
                pos += 2;
                while (pos < sql.length() && Character.isDigit(sql.charAt(pos))) {
                    pos++;
                }
            }
            output.append('?');
        }

        private void identifier() {
            int start = pos;
            while (pos < sql.length() && isIdentifierPart(sql.charAt(pos))) {
                pos++;
            }
            String word = sql.substring(start, pos);
            String upper = word.toUpperCase(Locale.ROOT);
            if (COMMANDS.contains(upper)) {
                commands.add(upper);
            }
            output.append(options.replaceDigits() ? DIGITS.matcher(word).replaceAll("?") : word);
        }

        private static boolean isStringPrefix(char c) {
            return "EeBbXxNn".indexOf(c) >= 0;
        }

        private static boolean isIdentifierPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_' || c == '$';
        }

        private static boolean isTagPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }
    }
}
