package de.bsommerfeld.eventpulse.reddit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps Reddit API JSON to {@link RedditPost} and {@link RedditComment}.
 *
 * <p>
 * Listings have the shape {@code {"kind":"Listing","data":{"children":[...]}}}
 * where each child is {@code {"kind":"t3"|"t1"|"more","data":{...}}}. The
 * comments endpoint returns a two-element array: {@code [0]} is the post
 * listing, {@code [1]} the comment listing.
 */
final class RedditListingParser {

    private final ObjectMapper mapper;

    RedditListingParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    List<RedditPost> parsePosts(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        List<RedditPost> posts = new ArrayList<>();
        for (JsonNode child : root.path("data").path("children")) {
            if (!"t3".equals(child.path("kind").asText()))
                continue;
            JsonNode data = child.path("data");
            String id = data.path("id").asText(null);
            if (id == null || id.isEmpty())
                continue;

            posts.add(new RedditPost(
                    id,
                    data.path("subreddit").asText(null),
                    data.path("title").asText(""),
                    data.path("selftext").asText(""),
                    author(data),
                    created(data),
                    data.path("permalink").asText(null),
                    unescapeHtml(data.path("url").asText(null))));
        }
        return posts;
    }

    /**
     * Parses the comment listing of a {@code /comments/{id}} response. Only
     * {@code t1} children with a body are returned; "more" placeholders are
     * skipped.
     */
    List<RedditComment> parseComments(String json) throws JsonProcessingException {
        JsonNode root = mapper.readTree(json);
        JsonNode listing = root.isArray() ? root.path(1) : root;

        List<RedditComment> comments = new ArrayList<>();
        for (JsonNode child : listing.path("data").path("children")) {
            if (!"t1".equals(child.path("kind").asText()))
                continue;
            JsonNode data = child.path("data");
            if (!data.has("body") || data.get("body").isNull())
                continue;

            comments.add(new RedditComment(
                    data.path("id").asText(null),
                    data.get("body").asText(),
                    author(data),
                    created(data),
                    data.path("link_id").asText(null)));
        }
        return comments;
    }

    /** {@code true} if the {@code /about} response describes a subreddit. */
    boolean isSubreddit(String json) throws JsonProcessingException {
        return "t5".equals(mapper.readTree(json).path("kind").asText());
    }

    private static String author(JsonNode data) {
        String author = data.path("author").asText(null);
        return isRealAuthor(author) ? author : null;
    }

    private static Instant created(JsonNode data) {
        JsonNode created = data.get("created_utc");
        if (created == null || !created.isNumber())
            return null;
        return Instant.ofEpochSecond(created.asLong());
    }

    /**
     * Placeholder authors carry no attribution and are stored as
     * {@code null}.
     */
    static boolean isRealAuthor(String author) {
        return author != null && !author.isEmpty()
                && !author.equals("[deleted]") && !author.equals("[removed]");
    }

    /**
     * Reverses HTML entity encoding that Reddit applies to URL fields when
     * {@code raw_json=1} is not honored.
     */
    static String unescapeHtml(String url) {
        if (url == null)
            return null;
        return url.replace("&amp;", "&")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&apos;", "'");
    }
}
