package ai.prettylayout.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class RingBufferTest {

    @Test
    void indicesStayAbsoluteAcrossPops() {
        RingBuffer<String> buffer = new RingBuffer<>();
        long a = buffer.push("a");
        long b = buffer.push("b");
        buffer.popFirst();
        long c = buffer.push("c");

        assertThat(a).isZero();
        assertThat(b).isEqualTo(1);
        assertThat(c).isEqualTo(2);
        assertThat(buffer.indexOfFirst()).isEqualTo(1);
        assertThat(buffer.get(b)).isEqualTo("b");
        assertThat(buffer.get(c)).isEqualTo("c");
    }

    @Test
    void growsPastInitialCapacityWhileWrapped() {
        RingBuffer<Integer> buffer = new RingBuffer<>();
        for (int i = 0; i < 10; i++) {
            buffer.push(i);
        }
        for (int i = 0; i < 10; i++) {
            buffer.popFirst();
        }
        for (int i = 10; i < 50; i++) {
            buffer.push(i);
        }

        assertThat(buffer.size()).isEqualTo(40);
        assertThat(buffer.first()).isEqualTo(10);
        assertThat(buffer.last()).isEqualTo(49);
        assertThat(buffer.secondLast()).isEqualTo(48);
        assertThat(buffer.get(30)).isEqualTo(30);
    }

    @Test
    void popLastRemovesNewestEntry() {
        RingBuffer<String> buffer = new RingBuffer<>();
        buffer.push("a");
        buffer.push("b");

        assertThat(buffer.popLast()).isEqualTo("b");
        assertThat(buffer.push("c")).isEqualTo(1);
        assertThat(buffer.last()).isEqualTo("c");
    }

    @Test
    void clearInvalidatesOldIndices() {
        RingBuffer<String> buffer = new RingBuffer<>();
        long a = buffer.push("a");
        buffer.push("b");
        buffer.clear();

        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.indexOfFirst()).isEqualTo(2);
        assertThatThrownBy(() -> buffer.get(a)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(buffer::first).isInstanceOf(NoSuchElementException.class);
        assertThat(buffer.push("c")).isEqualTo(2);
    }
}
