package de.bsommerfeld.eventpulse.reddit;

import com.google.inject.Singleton;
import de.bsommerfeld.eventpulse.core.config.WorkerConfig;
import de.bsommerfeld.eventpulse.core.domain.MatchKind;
import de.bsommerfeld.eventpulse.core.domain.RawItem;
import de.bsommerfeld.eventpulse.core.result.CallResult;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes a search plan against a single target and flattens the result
 * into {@link RawItem}s: each post, followed by its top-level comments.
 *
 * <h3>Failure isolation</h3>
 * Nothing here throws for expected platform conditions. An inaccessible or
 * failing target is logged and reported as a failed {@link TargetFetch}; a
 * failed comment fetch is logged and only costs that post's comments.
 *
 * <h3>Fallback</h3>
 * When enabled and the target is NOT_FOUND or FORBIDDEN, the query is tried
 * as a subreddit name (its hot listing), and after that as a search of
 * {@code r/all}. Items found through a fallback keep the original target as
 * their source.
 */
@Singleton
public class MatchFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(MatchFetcher.class);

    static final String SORT_NEW = "new";
    static final String GLOBAL_TARGET = "all";

    private final SocialClient client;
    private final boolean searchFallback;

    @Inject
    public MatchFetcher(SocialClient client, WorkerConfig config) {
        this(client, config.isSearchFallback());
    }

    public MatchFetcher(SocialClient client, boolean searchFallback) {
        this.client = client;
        this.searchFallback = searchFallback;
    }

    public TargetFetch fetch(String target, String query, int maxPosts, int maxComments) {
        CallResult<TargetHandle> handle = resolve(target);
        CallResult<List<RedditPost>> posts = handle.isOk()
                ? search(handle.value(), query, maxPosts)
                : handle.asFailure();

        if (!posts.isOk() && posts.isInaccessible() && searchFallback) {
            LOG.info("r/{} is {}, trying fallback for '{}'", target, posts.status(), query);
            return fallback(target, query, maxPosts, maxComments, posts);
        }
        if (!posts.isOk()) {
            LOG.warn("Skipping r/{}: {} ({})", target, posts.status(), posts.detail());
            return TargetFetch.failed(target, posts.status(), posts.detail());
        }
        return TargetFetch.ok(target, collect(target, handle.value(), posts.value(), maxComments));
    }

    private CallResult<TargetHandle> resolve(String name) {
        try {
            return client.getTarget(name);
        } catch (RuntimeException e) {
            LOG.warn("Resolving r/{} failed unexpectedly", name, e);
            return CallResult.transientError(e.toString());
        }
    }

    private CallResult<List<RedditPost>> hot(TargetHandle handle, int maxPosts) {
        try {
            return handle.hot(maxPosts);
        } catch (RuntimeException e) {
            LOG.warn("Hot listing of r/{} failed unexpectedly", handle.name(), e);
            return CallResult.transientError(e.toString());
        }
    }

    private CallResult<List<RedditPost>> search(TargetHandle handle, String query, int maxPosts) {
        try {
            return handle.search(query, SORT_NEW, maxPosts);
        } catch (RuntimeException e) {
            LOG.warn("Search of r/{} failed unexpectedly", handle.name(), e);
            return CallResult.transientError(e.toString());
        }
    }

    private TargetFetch fallback(String target, String query, int maxPosts, int maxComments,
            CallResult<List<RedditPost>> original) {
        CallResult<TargetHandle> named = resolve(query);
        if (named.isOk()) {
            CallResult<List<RedditPost>> hot = hot(named.value(), maxPosts);
            if (hot.isOk()) {
                return TargetFetch.ok(target, collect(target, named.value(), hot.value(), maxComments));
            }
        }

        CallResult<TargetHandle> global = resolve(GLOBAL_TARGET);
        if (global.isOk()) {
            CallResult<List<RedditPost>> found = search(global.value(), query, maxPosts);
            if (found.isOk()) {
                return TargetFetch.ok(target, collect(target, global.value(), found.value(), maxComments));
            }
        }

        LOG.warn("Skipping r/{}: {} and every fallback failed ({})", target, original.status(), original.detail());
        return TargetFetch.failed(target, original.status(), original.detail());
    }

    private List<RawItem> collect(String target, TargetHandle handle, List<RedditPost> posts, int maxComments) {
        List<RawItem> items = new ArrayList<>();
        for (RedditPost post : posts) {
            items.add(toItem(target, post));
            if (maxComments > 0) {
                items.addAll(comments(target, handle, post, maxComments));
            }
        }
        LOG.debug("r/{}: {} posts, {} items", target, posts.size(), items.size());
        return items;
    }

    private List<RawItem> comments(String target, TargetHandle handle, RedditPost post, int maxComments) {
        CallResult<List<RedditComment>> result;
        try {
            result = handle.comments(post, maxComments);
        } catch (RuntimeException e) {
            LOG.warn("Comments of post {} in r/{} failed unexpectedly", post.id(), target, e);
            return List.of();
        }
        if (!result.isOk()) {
            LOG.warn("Comments of post {} in r/{} unavailable: {} ({})", post.id(), target,
                    result.status(), result.detail());
            return List.of();
        }

        List<RawItem> items = new ArrayList<>();
        for (RedditComment comment : result.value()) {
            if (items.size() >= maxComments)
                break;
            items.add(toItem(target, post, comment));
        }
        return items;
    }

    static RawItem toItem(String target, RedditPost post) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("permalink", post.permalink());
        extra.put("url", post.url());
        return new RawItem(MatchKind.POST, target, post.id(), post.title(), post.selftext(), post.author(),
                post.createdAt(), extra, null);
    }

    /** Comments without a timestamp inherit the creation time of their post. */
    static RawItem toItem(String target, RedditPost post, RedditComment comment) {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("link_id", comment.linkId() != null ? comment.linkId() : "t3_" + post.id());
        Instant created = comment.createdAt() != null ? comment.createdAt() : post.createdAt();
        return new RawItem(MatchKind.COMMENT, target, comment.id(), null, comment.body(), comment.author(),
                created, extra, post.id());
    }
}
