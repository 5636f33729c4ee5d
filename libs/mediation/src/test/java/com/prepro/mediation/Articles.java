package com.prepro.mediation;

import com.prepro.mediation.testing.InMemoryRecordProvider;

/**
 * Fixtures for the mediation tests.
 */
final class Articles {

    private Articles() {
        // fixtures
    }

    static InMemoryRecordProvider<Article> provider() {
        return new InMemoryRecordProvider<>(Article.class, Article::new, Article::getId, Article::setId);
    }

    /** A provider whose validator rejects articles without a title. */
    static InMemoryRecordProvider<Article> validatingProvider() {
        return provider().validateWith(article -> article.getTitle() != null && !article.getTitle().isBlank());
    }
}
