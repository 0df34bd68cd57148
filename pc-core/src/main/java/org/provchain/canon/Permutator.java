package org.provchain.canon;

import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.BNode;

/**
 * Enumerates the permutations of a list of blank nodes in lexicographic order of their
 * identifiers, starting from the sorted list.
 */
final class Permutator implements Iterator<List<BNode>> {

    private static final Comparator<BNode> ID_ORDER = new Comparator<BNode>() {

        @Override
        public int compare(final BNode first, final BNode second) {
            return first.getID().compareTo(second.getID());
        }

    };

    private final List<BNode> elements;

    private final int[] indexes;

    private boolean hasNext;

    Permutator(final List<BNode> elements) {
        final List<BNode> sorted = Lists.newArrayList(elements);
        Collections.sort(sorted, ID_ORDER);
        this.elements = ImmutableList.copyOf(sorted);
        this.indexes = new int[sorted.size()];
        for (int i = 0; i < this.indexes.length; ++i) {
            this.indexes[i] = i;
        }
        this.hasNext = true;
    }

    @Override
    public boolean hasNext() {
        return this.hasNext;
    }

    @Override
    public List<BNode> next() {
        if (!this.hasNext) {
            throw new NoSuchElementException();
        }
        final ImmutableList.Builder<BNode> builder = ImmutableList.builder();
        for (final int index : this.indexes) {
            builder.add(this.elements.get(index));
        }
        this.hasNext = advance();
        return builder.build();
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException();
    }

    private boolean advance() {
        final int[] a = this.indexes;
        int i = a.length - 2;
        while (i >= 0 && a[i] >= a[i + 1]) {
            --i;
        }
        if (i < 0) {
            return false;
        }
        int j = a.length - 1;
        while (a[j] <= a[i]) {
            --j;
        }
        swap(a, i, j);
        for (int l = i + 1, r = a.length - 1; l < r; ++l, --r) {
            swap(a, l, r);
        }
        return true;
    }

    private static void swap(final int[] array, final int i, final int j) {
        final int tmp = array[i];
        array[i] = array[j];
        array[j] = tmp;
    }

}
