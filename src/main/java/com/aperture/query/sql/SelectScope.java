package com.aperture.query.sql;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Name resolution context of one SELECT. Relations are keyed by their normalized qualifier;
 * the parent scope belongs to the enclosing query of a correlated sub-select.
 */
final class SelectScope {

    private final SelectScope parent;
    private final Map<String, Relation> relations = new LinkedHashMap<>();
    private final List<Relation> anonymous = new ArrayList<>();
    private final Set<String> selectAliases = new HashSet<>();

    SelectScope(SelectScope parent) {
        this.parent = parent;
    }

    SelectScope getParent() {
        return parent;
    }

    /**
     * @return false if the qualifier is already taken in this scope
     */
    boolean addRelation(Relation relation) {
        if (relation.getQualifier() == null) {
            anonymous.add(relation);
            return true;
        }
        return relations.putIfAbsent(SqlIdentifiers.normalize(relation.getQualifier()), relation) == null;
    }

    Relation findRelation(String qualifier) {
        return relations.get(SqlIdentifiers.normalize(qualifier));
    }

    List<Relation> getRelations() {
        List<Relation> all = new ArrayList<>(relations.values());
        all.addAll(anonymous);
        return all;
    }

    List<Relation> relationsWithColumn(String normalizedColumn) {
        List<Relation> matches = new ArrayList<>();
        for (Relation relation : getRelations()) {
            if (relation.hasColumn(normalizedColumn)) {
                matches.add(relation);
            }
        }
        return matches;
    }

    void addSelectAlias(String alias) {
        selectAliases.add(SqlIdentifiers.normalize(alias));
    }

    boolean hasSelectAlias(String normalizedName) {
        return selectAliases.contains(normalizedName);
    }
}
