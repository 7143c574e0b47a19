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

package io.avtags.command.aggregate;

/// One row of the alias report.
///
/// {@code rarer} is the tag of the pair seen in fewer samples (on a tie, the lexicographically
/// larger one). {@code f} is the fraction of its samples that also carry {@code common};
/// {@code finv} is the fraction of {@code common}'s samples that also carry {@code rarer}.
public record AliasRow(String rarer, String common, long rarerCount, long commonCount,
                       long coCount, double f, double finv) {
}
