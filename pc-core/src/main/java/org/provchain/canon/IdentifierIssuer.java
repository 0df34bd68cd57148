package org.provchain.canon;

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.Maps;

import org.openrdf.model.BNode;

/**
 * Issues sequential identifiers ({@code prefix0}, {@code prefix1}, ...) to blank nodes,
 * remembering the issue order.
 */
final class IdentifierIssuer {

    private final String prefix;

    private final Map<BNode, String> issued;

    IdentifierIssuer(final String prefix) {
        this.prefix = prefix;
        this.issued = Maps.newLinkedHashMap();
    }

    private IdentifierIssuer(final IdentifierIssuer source) {
        this.prefix = source.prefix;
        this.issued = Maps.newLinkedHashMap(source.issued);
    }

    String issue(final BNode bnode) {
        String id = this.issued.get(bnode);
        if (id == null) {
            id = this.prefix + this.issued.size();
            this.issued.put(bnode, id);
        }
        return id;
    }

    boolean has(final BNode bnode) {
        return this.issued.containsKey(bnode);
    }

    @Nullable
    String get(final BNode bnode) {
        return this.issued.get(bnode);
    }

    Set<BNode> issueOrder() {
        return this.issued.keySet();
    }

    IdentifierIssuer copy() {
        return new IdentifierIssuer(this);
    }

    @Override
    public String toString() {
        return this.prefix + this.issued.values();
    }

}
