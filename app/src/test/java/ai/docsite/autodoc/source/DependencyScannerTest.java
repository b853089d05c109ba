package ai.docsite.autodoc.source;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DependencyScannerTest {

    private final DependencyScanner scanner = new DependencyScanner();

    @Test
    void followsRelativeAliasedAndRequiredImportsRecursively() {
        Map<String, String> files = Map.of(
                "src/pages/home.tsx", """
                        import React from 'react';
                        import { Button } from '@/components/button';
                        import { fetchUser } from '../services/user';
                        const config = require('./config');
                        """,
                "src/components/button.tsx", "import { cn } from '../lib/cn';",
                "src/services/user.ts", "import axios from 'axios';",
                "src/pages/config.js", "module.exports = {};",
                "src/lib/cn/index.ts", "import { twMerge } from '@scope/merge';");

        assertThat(scanner.scan("src/pages/home.tsx", path -> Optional.ofNullable(files.get(path))))
                .containsExactly("src/components/button.tsx", "src/services/user.ts", "src/pages/config.js",
                        "src/lib/cn/index.ts");
    }

    @Test
    void cyclesAreVisitedOnce() {
        Map<String, String> files = Map.of(
                "a.ts", "import { b } from './b';",
                "b.ts", "import { a } from './a';");

        assertThat(scanner.scan("a.ts", path -> Optional.ofNullable(files.get(path)))).containsExactly("b.ts");
    }

    @Test
    void unresolvedImportsAreSkipped() {
        assertThat(scanner.scan("a.ts", path -> path.equals("a.ts")
                ? Optional.of("import x from './missing';")
                : Optional.empty())).isEmpty();
    }

    @Test
    void classifiesSpecifiers() {
        assertThat(DependencyScanner.isInternal("./x")).isTrue();
        assertThat(DependencyScanner.isInternal("@/lib/x")).isTrue();
        assertThat(DependencyScanner.isInternal("@angular/core")).isFalse();
        assertThat(DependencyScanner.isInternal("lodash")).isFalse();
        assertThat(DependencyScanner.isInternal("my-app/utils/date")).isTrue();
    }

    @Test
    void normalizesDotSegments() {
        assertThat(DependencyScanner.normalize("src/pages/../lib/./x")).isEqualTo("src/lib/x");
        assertThat(DependencyScanner.normalize("../outside")).isEmpty();
    }
}
