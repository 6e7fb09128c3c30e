package com.chauhraj.kdbtick.datatypes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FlipTest {

  @Test
  void unkeyPutsKeyColumnsFirst() {
    Flip keys = new Flip(new String[] {"k1"}, new Object[] {new long[] {1, 2}});
    Flip values = new Flip(new String[] {"v1", "v2"}, new Object[] {new String[] {"a", "b"}, new double[] {1.5, 2.5}});

    Flip table = Flip.unkey(new Dict(keys, values));

    assertThat(table.x).containsExactly("k1", "v1", "v2");
    assertThat(table.at("k1")).isEqualTo(new long[] {1, 2});
    assertThat(table.at("v2")).isEqualTo(new double[] {1.5, 2.5});
    assertThat(table.rowCount()).isEqualTo(2);
  }

  @Test
  void unkeyLeavesASimpleTableAlone() {
    Flip table = new Flip(new String[] {"a"}, new Object[] {new int[] {1}});
    assertThat(Flip.unkey(table)).isSameAs(table);
  }

  @Test
  void unkeyRejectsOtherValues() {
    assertThatThrownBy(() -> Flip.unkey(new Dict(new String[] {"a"}, new long[] {1})))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fromDict() {
    Flip table = new Flip(new Dict(new String[] {"sym", "px"}, new Object[] {new String[] {"a"}, new double[] {1.0}}));
    assertThat(table.at("sym")).isEqualTo(new String[] {"a"});
    assertThatThrownBy(() -> table.at("qty")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Flip(new Dict(new long[] {1}, new Object[] {new long[] {1}})))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void columnCountsMustMatch() {
    assertThatThrownBy(() -> new Flip(new String[] {"a", "b"}, new Object[] {new long[0]}))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
