package de.bsommerfeld.eventpulse.reddit;

import de.bsommerfeld.eventpulse.core.result.CallResult;

/**
 * Entry point into a social platform. Resolves a target (a subreddit) to a
 * handle that can be searched and listed.
 *
 * @see RedditApiClient
 * @see OfflineSocialClient
 */
public interface SocialClient {

    /**
     * @return {@code OK} with a handle, {@code NOT_FOUND} for unknown targets,
     *         {@code FORBIDDEN} for private or banned ones, or
     *         {@code TRANSIENT_ERROR}
     */
    CallResult<TargetHandle> getTarget(String name);
}
