package de.bsommerfeld.eventpulse.reddit;

import de.bsommerfeld.eventpulse.core.result.CallResult;

import java.util.List;

/**
 * A resolved subreddit. Every call is independent and reports its own
 * outcome; a failed comment fetch says nothing about the next search.
 */
public interface TargetHandle {

    String name();

    CallResult<List<RedditPost>> search(String query, String sort, int limit);

    CallResult<List<RedditPost>> hot(int limit);

    /** Top-level comments of {@code post}, at most {@code limit}. */
    CallResult<List<RedditComment>> comments(RedditPost post, int limit);
}
