package de.bsommerfeld.eventpulse.reddit;

import java.time.Instant;

/**
 * A submission as returned by a listing or search.
 *
 * @param id        bare base36 id (without the {@code t3_} prefix)
 * @param subreddit subreddit the post lives in
 * @param title     post title
 * @param selftext  body of a self post, empty for link posts
 * @param author    author name, {@code null} if deleted
 * @param createdAt creation time, {@code null} if not reported
 * @param permalink path relative to reddit.com
 * @param url       link target (or the post itself for self posts)
 */
public record RedditPost(
        String id,
        String subreddit,
        String title,
        String selftext,
        String author,
        Instant createdAt,
        String permalink,
        String url) {
}
