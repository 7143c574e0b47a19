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

import io.avtags.api.model.Category;
import io.avtags.api.model.RankedTag;
import io.avtags.labeling.taxonomy.PathTaxonomy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CategoryCoverage and FamilySelector")
class CategoryCoverageTest {

    private final PathTaxonomy taxonomy = PathTaxonomy.parse(List.of(
        "CLASS:malware:banker", "CLASS:malware:trojan", "BEH:infosteal", "FILE:os:windows", "FAM:zeus"));

    @Test
    @DisplayName("should count each category once per sample")
    void shouldCountCategoriesOnce() {
        Set<Category> touched = CategoryCoverage.categoriesOf(List.of(
            new RankedTag("banker", 4), new RankedTag("trojan", 3), new RankedTag("foobar", 2)), taxonomy);

        assertThat(touched).containsExactlyInAnyOrder(Category.CLASS, Category.UNKNOWN);

        CategoryCoverage coverage = new CategoryCoverage();
        coverage.record(touched);
        coverage.record(Set.of(Category.FAMILY));

        assertThat(coverage.maltagged()).isEqualTo(2);
        assertThat(coverage.count(Category.CLASS)).isEqualTo(1);
        assertThat(coverage.count(Category.FAMILY)).isEqualTo(1);
        assertThat(coverage.count(Category.FILE)).isZero();
    }

    @Test
    @DisplayName("should touch no category for a sample without tags")
    void shouldTouchNothingWithoutTags() {
        assertThat(CategoryCoverage.categoriesOf(List.of(), taxonomy)).isEmpty();
    }

    @Test
    @DisplayName("should pick the first family or unknown tag")
    void shouldSelectFamily() {
        FamilySelector selector = new FamilySelector(taxonomy);

        assertThat(selector.select(List.of(
            new RankedTag("windows", 5), new RankedTag("zeus", 4), new RankedTag("foobar", 4)), "h1"))
            .isEqualTo("zeus");
        assertThat(selector.select(List.of(
            new RankedTag("windows", 5), new RankedTag("foobar", 4)), "h1"))
            .isEqualTo("foobar");
    }

    @Test
    @DisplayName("should fall back to a singleton label")
    void shouldFallBackToSingleton() {
        FamilySelector selector = new FamilySelector(taxonomy);

        assertThat(selector.select(List.of(new RankedTag("banker", 3)), "h1")).isEqualTo("SINGLETON:h1");
        assertThat(selector.select(List.of(), "h2")).isEqualTo("SINGLETON:h2");
    }
}
