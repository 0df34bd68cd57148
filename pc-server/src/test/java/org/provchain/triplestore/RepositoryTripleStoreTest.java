package org.provchain.triplestore;

public class RepositoryTripleStoreTest extends AbstractTripleStoreTest {

    @Override
    protected TripleStore createTripleStore() {
        return new RepositoryTripleStore();
    }

}
