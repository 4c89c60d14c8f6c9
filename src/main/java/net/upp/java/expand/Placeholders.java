// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.upp.java.expand;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.upp.java.edit.Document;

/**
 * The contents stored under placeholder tokens of the form {@code __UPP_MARKER_<n>__}. A token
 * stands for its content wherever it appears in generated text, and is substituted, recursively,
 * when that text is committed.
 */
final class Placeholders {

  static final Pattern TOKEN = Pattern.compile("__UPP_MARKER_(\\d+)__");

  private final Map<String, String> contents = new HashMap<>();
  private int next;

  /** Stores {@code content} under a new token and returns the token. */
  String mint(String content) {
    String token = "__UPP_MARKER_" + next++ + "__";
    contents.put(token, content);
    return token;
  }

  /** Replaces the content stored under a token minted earlier. */
  void put(String token, String content) {
    Preconditions.checkArgument(contents.containsKey(token), "unknown placeholder %s", token);
    contents.put(token, content);
  }

  boolean isEmpty() {
    return contents.isEmpty();
  }

  int size() {
    return contents.size();
  }

  /**
   * Returns {@code text} with every known token replaced by its content, recursively. Unknown
   * tokens are left as they are.
   *
   * @throws IllegalStateException if a token's content contains the token itself
   */
  String resolve(String text) {
    return resolve(text, new HashSet<>());
  }

  private String resolve(String text, Set<String> active) {
    if (text.indexOf("__UPP_MARKER_") < 0) {
      return text;
    }
    Matcher m = TOKEN.matcher(text);
    StringBuilder buf = new StringBuilder();
    int last = 0;
    while (m.find()) {
      String token = m.group();
      String content = contents.get(token);
      if (content == null) {
        continue;
      }
      Preconditions.checkState(active.add(token), "placeholder %s contains itself", token);
      buf.append(text, last, m.start()).append(resolve(content, active));
      active.remove(token);
      last = m.end();
    }
    return buf.append(text, last, text.length()).toString();
  }

  /**
   * Substitutes the tokens left in a document's text and returns those that have no content,
   * in order of appearance.
   */
  List<String> sweep(Document doc) {
    List<int[]> ranges = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    Matcher m = TOKEN.matcher(doc.text());
    while (m.find()) {
      if (contents.containsKey(m.group())) {
        ranges.add(new int[] {m.start(), m.end()});
      } else {
        unknown.add(m.group());
      }
    }
    String text = doc.text();
    for (int i = ranges.size() - 1; i >= 0; i--) {
      int[] r = ranges.get(i);
      doc.splice(r[0], r[1] - r[0], resolve(text.substring(r[0], r[1])));
    }
    return unknown;
  }

  void clear() {
    contents.clear();
  }
}
