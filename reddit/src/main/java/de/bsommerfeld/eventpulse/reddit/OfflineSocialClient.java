package de.bsommerfeld.eventpulse.reddit;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Offline stand-in for {@link RedditApiClient} used in TEST mode. No HTTP
 * requests are made.
 *
 * <h3>Deterministic data</h3>
 * Post and comment ids derive from the target, the query and the position,
 * so repeated cycles return the same items and exercise the duplicate path of
 * the persistence gate exactly like a real subreddit without new activity.
 *
 * <h3>Simulated failures</h3>
 * <ul>
 * <li>targets starting with {@code missing} → NOT_FOUND</li>
 * <li>targets starting with {@code private} → FORBIDDEN</li>
 * </ul>
 */
@Singleton
public class OfflineSocialClient implements SocialClient {

    private static final Logger LOG = LoggerFactory.getLogger(OfflineSocialClient.class);

    private static final Instant BASE_TIME = Instant.parse("2024-05-01T12:00:00Z");

    private static final List<String> POST_BODIES = List.of(
            "Really excited about this, it was great last year!",
            "Does anyone know if this is still happening? Seems badly organized.",
            "",
            "Free pizza and good people. Highly recommend.",
            "Not sure it is worth the trip, the last one was boring.");

    private static final List<String> COMMENT_BODIES = List.of(
            "Love it, count me in!",
            "This sounds terrible honestly.",
            "I went last time, it was okay.",
            "Amazing speakers, great vibe.",
            "Meh. Not impressed.",
            "Thanks for sharing, very helpful!");

    public OfflineSocialClient() {
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Reddit API access is DISABLED   #");
        LOG.warn("#  Using deterministic offline data                   #");
        LOG.warn("#######################################################");
    }

    @Override
    public CallResult<TargetHandle> getTarget(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        if (lower.isEmpty() || lower.startsWith("missing") || lower.contains(" ")) {
            return CallResult.notFound("r/" + name + " does not exist");
        }
        if (lower.startsWith("private")) {
            return CallResult.forbidden("r/" + name + " is private");
        }
        return CallResult.ok(new OfflineTarget(name));
    }

    private static final class OfflineTarget implements TargetHandle {

        private final String name;

        OfflineTarget(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public CallResult<List<RedditPost>> search(String query, String sort, int limit) {
            LOG.debug("[TEST] Simulating search of r/{} for '{}'", name, query);
            String headline = query.split(" OR ")[0];
            return CallResult.ok(posts(headline, Math.min(limit, 3)));
        }

        @Override
        public CallResult<List<RedditPost>> hot(int limit) {
            LOG.debug("[TEST] Simulating hot listing of r/{}", name);
            return CallResult.ok(posts("hot", Math.min(limit, 2)));
        }

        @Override
        public CallResult<List<RedditComment>> comments(RedditPost post, int limit) {
            List<RedditComment> comments = new ArrayList<>();
            int count = Math.min(limit, 1 + Math.floorMod(post.id().hashCode(), COMMENT_BODIES.size()));
            for (int i = 0; i < count; i++) {
                String body = COMMENT_BODIES.get(Math.floorMod(post.id().hashCode() + i, COMMENT_BODIES.size()));
                comments.add(new RedditComment(post.id() + "c" + i, body, "student" + i,
                        post.createdAt().plusSeconds(60L * (i + 1)), "t3_" + post.id()));
            }
            return CallResult.ok(comments);
        }

        private List<RedditPost> posts(String headline, int count) {
            List<RedditPost> posts = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String id = Integer.toString(Math.floorMod((name + "|" + headline + "|" + i).hashCode(), 1 << 30), 36);
                String body = POST_BODIES.get(Math.floorMod(id.hashCode(), POST_BODIES.size()));
                posts.add(new RedditPost(id, name, "Anyone going to the " + headline + " thing?", body,
                        "campus_user" + i, BASE_TIME.plusSeconds(3600L * i),
                        "/r/" + name + "/comments/" + id + "/", "https://www.reddit.com/r/" + name
                                + "/comments/" + id + "/"));
            }
            return posts;
        }
    }
}
