/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.avtags.labeling.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/// Splits a raw detection label into lower-case tokens.
///
/// {@code Trojan.Win32.Zbot!gen} yields {@code trojan, win32, zbot, gen}.
public class LabelTokenizer {

  private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");

  public List<String> tokens(String label) {
    List<String> out = new ArrayList<>();
    for (String token : SEPARATORS.split(label.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        out.add(token);
      }
    }
    return out;
  }
}
