package com.librarian.store;

public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    /**
     * Names the vector space this service produces, dimension included. A store whose chunks carry another version
     * is re-embedded when it is opened with this service.
     */
    String version();
}
