package com.prepro.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.prepro.mediation.AuthorizationException;
import com.prepro.mediation.ListingPolicy;
import com.prepro.mediation.Presentation;
import com.prepro.mediation.ReadMediator;
import com.prepro.mediation.WriteHooks;
import com.prepro.mediation.WriteMediator;
import com.prepro.mediation.testing.InMemoryRecordProvider;
import com.prepro.observability.MediationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Records written and read back through the mediators, rendered with a fixed clock.
 */
@DisplayName("Presented posts")
class PresentedPostTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private InMemoryRecordProvider<Post> provider;
    private ReadMediator<String, Post> reader;
    private WriteMediator<String, Post> writer;
    private DefaultViewContext view;

    @BeforeEach
    void setUp() {
        var metrics = new MediationMetrics(new SimpleMeterRegistry(), "prepro-test");
        provider = new InMemoryRecordProvider<>(Post.class, Post::new, Post::getId, Post::setId);
        reader = new ReadMediator<>(provider, ListingPolicy.everyone(), metrics);
        writer = new WriteMediator<>(provider, WriteHooks.none(), metrics);
        view = new DefaultViewContext(Clock.fixed(NOW, ZoneOffset.UTC), DateTimeFormats.defaults());
    }

    @Test
    @DisplayName("a created post is rendered for its author and for other readers")
    void createThenPresent() {
        var created = writer.create(Map.of(
                "title", "Hello",
                "author", "ada",
                "publishedAt", NOW.minus(Duration.ofDays(3)).toString(),
                "featured", true), "ada");
        assertThat(created.success()).isTrue();
        Long id = created.record().getId();

        Post own = reader.presentOne(id, "ada", view);
        Post other = reader.presentOne(String.valueOf(id), "grace", view);

        assertThat(own.byline()).isEqualTo("by you");
        assertThat(other.byline()).isEqualTo("by ada");
        assertThat(other.formattedDatetime(other.getPublishedAt(), PresentableRecord.DISTANCE_IN_WORDS,
                RelativeTimeOptions.defaults().withTextOnly(true))).isEqualTo("3 days ago");
        assertThat(other.formattedBoolean(other.getFeatured())).isEqualTo("Yes");
    }

    @Test
    @DisplayName("unpublished posts are hidden from other readers")
    void unpublishedHidden() {
        Post draft = new Post();
        draft.setTitle("Draft");
        draft.setAuthor("ada");
        long id = provider.insert(draft);

        assertThat(reader.presentOne(id, "ada", view).getTitle()).isEqualTo("Draft");
        assertThatThrownBy(() -> reader.presentOne(id, "grace", view))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    @DisplayName("every post of a listing carries the viewer")
    void listing() {
        for (String author : List.of("ada", "grace")) {
            Post post = new Post();
            post.setTitle("By " + author);
            post.setAuthor(author);
            post.setPublishedAt(NOW.minus(Duration.ofHours(2)));
            provider.insert(post);
        }

        Presentation<Post> presentation = reader.present(provider.all(), "ada", view);

        assertThat(presentation.collection()).isTrue();
        assertThat(presentation.records())
                .extracting(Post::byline)
                .containsExactly("by you", "by grace");
        assertThat(presentation.records())
                .extracting(post -> post.timeAgoInWords(post.getPublishedAt(),
                        RelativeTimeOptions.defaults().withTextOnly(true)))
                .containsOnly("2 hours ago");
    }
}
