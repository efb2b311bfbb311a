package org.codeindex.index;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocationFormatterTest {

    private final FileRegistry files = SampleIndex.create().files();

    @Test
    void key_usesRegisteredPathByDefault() {
        LocationFormatter formatter = new LocationFormatter(files, false);

        assertThat(formatter.key(new Location(1, 15, 9))).isEqualTo("/work/app/src/main.cpp:15:9:");
    }

    @Test
    void key_rendersPathRelativeToSourceRootWhenRequested() {
        LocationFormatter formatter = new LocationFormatter(files, true);

        assertThat(formatter.key(new Location(1, 15, 9))).isEqualTo("src/main.cpp:15:9:");
        // 不在 sourceRoot 之下的路径保持原样
        assertThat(formatter.key(new Location(3, 40, 5))).isEqualTo("/usr/include/stdio.h:40:5:");
    }

    @Test
    void registeredKey_ignoresRelativeRendering() {
        LocationFormatter formatter = new LocationFormatter(files, true);

        assertThat(formatter.registeredKey(new Location(2, 3, 6))).isEqualTo("/work/app/src/util.cpp:3:6:");
        assertThat(formatter.registeredPath(2)).isEqualTo(SampleIndex.UTIL_CPP);
        assertThat(formatter.path(2)).isEqualTo("src/util.cpp");
    }

    @Test
    void path_marksUnknownFiles() {
        assertThat(new LocationFormatter(files, false).path(9)).isEqualTo("<unknown file 9>");
    }
}
