package org.codeindex.index;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatComparable;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeMapSymbolIndexTest {

    private final TreeMapSymbolIndex index = SampleIndex.create();

    @Test
    void locations_orderByFileThenLineThenColumn() {
        assertThatComparable(new Location(1, 99, 99)).isLessThan(new Location(2, 1, 1));
        assertThatComparable(new Location(2, 3, 9)).isLessThan(new Location(2, 4, 1));
        assertThatComparable(new Location(2, 3, 1)).isLessThan(new Location(2, 3, 2));
        assertThatComparable(new Location(2, 3, 1)).isEqualByComparingTo(new Location(2, 3, 1));
        assertThat(Location.NULL.isNull()).isTrue();
        assertThatThrownBy(() -> new Location(1, -1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void find_returnsCursorOnlyForExactLocation() {
        assertThat(index.find(new Location(1, 15, 9))).isPresent();
        assertThat(index.find(new Location(1, 15, 8))).isEmpty();
        assertThat(index.lookup(new Location(2, 3, 6))).map(SymbolRecord::symbolName).contains("helper(int)");
    }

    @Test
    void previous_walksBackwardAcrossFilesToBeginning() {
        SymbolIndex.Cursor cursor = index.find(new Location(2, 3, 6)).orElseThrow();

        List<Location> visited = new ArrayList<>();
        Optional<SymbolIndex.Cursor> current = cursor.previous();
        while (current.isPresent()) {
            visited.add(current.get().location());
            current = current.get().previous();
        }

        assertThat(visited).containsExactly(
                new Location(2, 1, 1),
                new Location(1, 30, 1),
                new Location(1, 25, 3),
                new Location(1, 15, 9),
                new Location(1, 12, 5),
                new Location(1, 10, 6)
        );
    }

    @Test
    void symbolsInFile_returnsOnlyThatFileInOrder() {
        assertThat(index.symbolsInFile(2))
                .extracting(r -> r.location().line())
                .containsExactly(1, 3, 5);
        assertThat(index.symbolsInFile(0)).isEmpty();
        assertThat(index.symbolsInFile(42)).isEmpty();
    }

    @Test
    void constructor_rejectsUnregisteredFile() {
        FileRegistry files = FileRegistry.of(null, Map.of(1, "/a.cpp"));
        SymbolRecord orphan = SampleIndex.symbol(7, 1, 1, "x", "x", SymbolKind.VAR_DECL, true, 1, 1, 1, 2);

        assertThatThrownBy(() -> new TreeMapSymbolIndex(files, List.of(orphan)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("7");
    }

    @Test
    void fileRegistry_rejectsReservedIdAndDuplicatePaths() {
        assertThatThrownBy(() -> FileRegistry.of(null, Map.of(0, "/a.cpp")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FileRegistry.of(null, Map.of(1, "/a.cpp", 2, "/a.cpp")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(index.files().fileId(SampleIndex.UTIL_CPP)).isEqualTo(2);
        assertThat(index.files().fileId("/nope.cpp")).isZero();
    }
}
