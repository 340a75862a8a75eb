package com.entity.canonical.index;

import com.entity.canonical.core.DuplicateIdentifierException;
import com.entity.canonical.core.MappingLoadException;
import com.entity.canonical.rules.DefaultNormalizationRules;
import com.entity.canonical.search.SynonymDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SynonymIndexBuilderTest {

    private SynonymIndexBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new SynonymIndexBuilder(DefaultNormalizationRules.createDefaultEngine());
    }

    private static List<Map<String, Object>> cities() {
        return List.of(
                Map.of("id", "city_1", "cname", "Seattle", "whitelist", List.of("SEA", "Emerald City")),
                Map.of("id", "city_3", "cname", "New York City", "whitelist", List.of("NYC", "Big Apple")),
                Map.of("id", "city_4", "cname", "New York Mills", "whitelist", List.of("NYC")));
    }

    @Nested
    @DisplayName("Synonym table")
    class SynonymTableTests {

        @Test
        @DisplayName("Registers the cname under itself and every alias, normalized")
        void testRegistersAliases() {
            SynonymIndex index = builder.build("city", cities());

            assertEquals(Set.of("Seattle"), index.lookup("seattle"));
            assertEquals(Set.of("Seattle"), index.lookup("sea"));
            assertEquals(Set.of("Seattle"), index.lookup("emerald city"));
            assertTrue(index.lookup("SEA").isEmpty());
            assertTrue(index.lookup("portland").isEmpty());
        }

        @Test
        @DisplayName("Keeps every cname claiming an alias, in discovery order")
        void testAmbiguousAlias() {
            SynonymIndex index = builder.build("city", cities());

            assertEquals(List.of("New York City", "New York Mills"), List.copyOf(index.lookup("nyc")));
        }

        @Test
        @DisplayName("Every cname in the synonym table has items")
        void testReferentialIntegrity() {
            SynonymIndex index = builder.build("city", cities());

            index.getSynonymTable().values().forEach(cnames ->
                    cnames.forEach(cname -> assertFalse(index.itemsFor(cname).isEmpty())));
        }

        @Test
        @DisplayName("Aliases normalizing to nothing are skipped")
        void testEmptyAlias() {
            SynonymIndex index = builder.build("city", List.of(
                    Map.of("cname", "Seattle", "whitelist", List.of("!!!"))));

            assertEquals(1, index.aliasCount());
            assertFalse(index.getSynonymTable().containsKey(""));
        }
    }

    @Nested
    @DisplayName("Item table")
    class ItemTableTests {

        @Test
        @DisplayName("Repeated cnames with different ids are all kept")
        void testDuplicateCnames() {
            SynonymIndex index = builder.build("city", List.of(
                    Map.of("id", "city_2", "cname", "Portland", "state", "OR"),
                    Map.of("id", "city_5", "cname", "Portland", "state", "ME")));

            assertEquals(2, index.itemsFor("Portland").size());
            assertEquals("city_2", index.itemsFor("Portland").get(0).getId());
            assertEquals(Set.of("Portland"), index.lookup("portland"));
        }

        @Test
        @DisplayName("A repeated id fails the build")
        void testDuplicateId() {
            DuplicateIdentifierException e = assertThrows(DuplicateIdentifierException.class,
                    () -> builder.build("city", List.of(
                            Map.of("id", "city_1", "cname", "Seattle"),
                            Map.of("id", "city_1", "cname", "Tacoma"))));

            assertEquals("city", e.getEntityType());
            assertEquals("city_1", e.getItemId());
        }

        @Test
        @DisplayName("Items without ids never collide")
        void testIdLessItems() {
            SynonymIndex index = builder.build("airline", List.of(
                    Map.of("cname", "Delta"),
                    Map.of("cname", "Delta")));

            assertEquals(2, index.itemCount());
        }

        @Test
        @DisplayName("An invalid record fails with its position")
        void testInvalidRecord() {
            MappingLoadException e = assertThrows(MappingLoadException.class,
                    () -> builder.build("city", List.of(
                            Map.of("cname", "Seattle"),
                            Map.of("id", "city_9"))));

            assertTrue(e.getMessage().contains("#1"));
        }

        @Test
        @DisplayName("Empty mapping yields an empty index")
        void testEmpty() {
            SynonymIndex index = builder.build("city", List.of());
            assertTrue(index.isEmpty());
            assertEquals(SynonymIndex.empty("city"), index);
        }
    }

    @Test
    @DisplayName("Identical input builds identical indexes")
    void testDeterministic() {
        assertEquals(builder.build("city", cities()), builder.build("city", cities()));
    }

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("One document per item with attributes outside id, cname and whitelist")
        void testToDocuments() {
            SynonymIndex index = builder.build("city", List.of(
                    Map.of("id", "city_1", "cname", "Seattle", "whitelist", List.of("SEA"), "state", "WA")));

            List<SynonymDocument> documents = builder.toDocuments(index);

            assertEquals(1, documents.size());
            SynonymDocument document = documents.get(0);
            assertEquals("city_1", document.id());
            assertEquals("Seattle", document.cname());
            assertEquals(List.of("SEA"), document.whitelist());
            assertEquals(Map.of("state", "WA"), document.attributes());
        }

        @Test
        @DisplayName("Items without ids get stable derived ids")
        void testDerivedIds() {
            SynonymIndex index = builder.build("airline", List.of(
                    Map.of("cname", "Delta"),
                    Map.of("cname", "Alaska"),
                    Map.of("cname", "Delta")));

            List<String> ids = builder.toDocuments(index).stream().map(SynonymDocument::id).toList();
            assertEquals(List.of("Delta#1", "Delta#2", "Alaska#1"), ids);
            assertEquals(ids, builder.toDocuments(builder.build("airline", List.of(
                    Map.of("cname", "Delta"),
                    Map.of("cname", "Alaska"),
                    Map.of("cname", "Delta")))).stream().map(SynonymDocument::id).toList());
        }
    }
}
