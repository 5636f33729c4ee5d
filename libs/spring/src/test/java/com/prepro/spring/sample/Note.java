package com.prepro.spring.sample;

import com.prepro.mediation.AccessPolicy;
import com.prepro.presentation.PresentableRecord;
import java.time.Instant;

/** A note owned by its author; everyone may read it, only the author may change it. */
public class Note extends PresentableRecord<String> implements AccessPolicy<String> {

    private Long id;
    private String body;
    private String author;
    private Instant createdAt;

    @Override
    public boolean viewableBy(String actor) {
        return true;
    }

    @Override
    public boolean creatableBy(String actor) {
        return actor != null;
    }

    @Override
    public boolean updatableBy(String actor) {
        return actor != null && actor.equals(author);
    }

    @Override
    public boolean destroyableBy(String actor) {
        return updatableBy(actor);
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public String getAuthor() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = author;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
