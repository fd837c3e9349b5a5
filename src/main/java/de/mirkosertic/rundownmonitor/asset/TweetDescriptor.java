package de.mirkosertic.rundownmonitor.asset;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contents of {@code tweet_api.json}, the descriptor consumed by the graphics templates.
 * Image fields hold absolute local paths, or an empty string when the tweet has no such image
 * or its download failed.
 */
public record TweetDescriptor(
        @JsonProperty("text") String text,
        @JsonProperty("name") String name,
        @JsonProperty("username") String username,
        @JsonProperty("profile_image") String profileImage,
        @JsonProperty("tweet_image") String tweetImage,
        @JsonProperty("has_video") boolean hasVideo
) {

    TweetDescriptor withImages(final String localProfileImage, final String localTweetImage) {
        return new TweetDescriptor(text, name, username, localProfileImage, localTweetImage, hasVideo);
    }
}
