package com.di.docsync.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RelationshipInference Tests")
class RelationshipInferenceTest {

    private static Table table(String name, String... columns) {
        List<Column> cols = new java.util.ArrayList<>();
        cols.add(new Column("id", "integer", false, null, null));
        for (String c : columns) {
            cols.add(new Column(c, "integer", true, null, null));
        }
        return new Table(name, 0, cols, List.of(), List.of(), null);
    }

    @Test
    @DisplayName("Should link photos.project_id to projects as many-to-one")
    void testInfer_PluralTarget() {
        List<ImplicitRelationship> rels = RelationshipInference.infer(List.of(
                table("projects"), table("photos", "project_id")));

        assertEquals(1, rels.size());
        ImplicitRelationship rel = rels.get(0);
        assertEquals("photos", rel.sourceTable());
        assertEquals("project_id", rel.sourceColumn());
        assertEquals("projects", rel.targetTable());
        assertEquals("id", rel.targetColumn());
        assertEquals(ImplicitRelationship.Cardinality.MANY_TO_ONE, rel.cardinality());
        assertEquals("project", rel.relationshipType());
    }

    @Test
    @DisplayName("Should drop id columns with no matching table")
    void testInfer_NoTarget() {
        List<ImplicitRelationship> rels = RelationshipInference.infer(List.of(
                table("projects"), table("photos", "owner_id", "project_id")));

        assertEquals(List.of("project_id"), rels.stream().map(ImplicitRelationship::sourceColumn).toList());
    }

    @Test
    @DisplayName("Should ignore tables that failed discovery, as source and as target")
    void testInfer_ErrorTables() {
        List<ImplicitRelationship> rels = RelationshipInference.infer(List.of(
                Table.failed("projects", "permission denied"), table("photos", "project_id")));

        assertTrue(rels.isEmpty());
    }

    @Test
    @DisplayName("Should resolve irregular plurals and singular table names")
    void testResolveTarget() {
        assertEquals("categories", RelationshipInference.resolveTarget("category", Set.of("categories")));
        assertEquals("boxes", RelationshipInference.resolveTarget("box", Set.of("boxes")));
        assertEquals("statuses", RelationshipInference.resolveTarget("status", Set.of("statuses")));
        assertEquals("person", RelationshipInference.resolveTarget("person", Set.of("person")));
        assertEquals("users", RelationshipInference.resolveTarget("users", Set.of("users")));
        assertNull(RelationshipInference.resolveTarget("owner", Set.of("projects")));
    }

    @Test
    @DisplayName("Should prefer the plural form when both exist")
    void testResolveTarget_PluralFirst() {
        assertEquals("projects", RelationshipInference.resolveTarget("project", Set.of("project", "projects")));
    }

    @Test
    @DisplayName("Should ignore a bare _id column")
    void testInfer_BareIdSuffix() {
        assertTrue(RelationshipInference.infer(List.of(table("things", "_id"))).isEmpty());
    }
}
