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

package io.avtags.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TagVendors")
class TagVendorsTest {

    @Test
    @DisplayName("should count each vendor once per tag")
    void shouldCountVendorsOnce() {
        TagVendors tv = new TagVendors()
            .add("zeus", "Kaspersky")
            .add("zeus", "Kaspersky")
            .add("zeus", "ESET");

        assertThat(tv.support("zeus")).isEqualTo(2);
        assertThat(tv.vendorsOf("zeus")).containsExactly("Kaspersky", "ESET");
    }

    @Test
    @DisplayName("should keep first-seen tag order")
    void shouldKeepFirstSeenOrder() {
        TagVendors tv = new TagVendors()
            .add("windows", "A")
            .add("banker", "A")
            .add("zeus", "B")
            .add("windows", "B");

        assertThat(tv.tags()).containsExactly("windows", "banker", "zeus");
        assertThat(tv.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("should report absent tags as unsupported")
    void shouldHandleAbsentTags() {
        TagVendors tv = new TagVendors();

        assertThat(tv.isEmpty()).isTrue();
        assertThat(tv.support("zeus")).isZero();
        assertThat(tv.vendorsOf("zeus")).isEmpty();
    }

    @Test
    @DisplayName("should not expose a mutable view")
    void shouldBeReadOnlyView() {
        TagVendors tv = new TagVendors().add("zeus", "A");

        assertThatThrownBy(() -> tv.tags().add("other"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
