package com.example.servicerota.role;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleCatalogTest {

    private final RoleDefinitions defs = RoleDefinitions.standard();

    @Test
    void rolesSharingAPoolSeeTheSamePeople() {
        RoleCatalog catalog = new RoleCatalog(defs, Map.of("vocal_sub", List.of("Carol", "Dan")));

        assertThat(catalog.qualifiedPeople("vocal_sub1")).containsExactly("Carol", "Dan");
        assertThat(catalog.qualifiedPeople("vocal_sub2")).containsExactly("Carol", "Dan");
    }

    @Test
    void missingOrEmptyPoolYieldsNobody() {
        RoleCatalog catalog = new RoleCatalog(defs, Map.of("piano", List.of(), "drum", List.of("Eve")));

        assertThat(catalog.qualifiedPeople("piano")).isEmpty();
        assertThat(catalog.qualifiedPeople("bass")).isEmpty();
        assertThat(catalog.rolesWithEmptyPool())
                .containsExactly("vocal_main", "vocal_sub1", "vocal_sub2", "piano", "bass", "pa", "ppt");
    }

    @Test
    void blankNamesAreIgnoredAndNamesTrimmed() {
        RoleCatalog catalog = new RoleCatalog(defs, Map.of("pa", List.of(" Frank ", "", "  ")));

        assertThat(catalog.qualifiedPeople("pa")).containsExactly("Frank");
    }

    @Test
    void unknownRole_isRejected() {
        RoleCatalog catalog = new RoleCatalog(defs, Map.of());

        assertThatThrownBy(() -> catalog.qualifiedPeople("organ"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
