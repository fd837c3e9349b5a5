package de.mirkosertic.rundownmonitor.asset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.rundownmonitor.config.ContentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches tweets referenced by rundown labels through the Twitter API v2.
 * <p>
 * For every tweet the target directory receives the author's profile image, the first photo of
 * the tweet (if any) and {@value #DESCRIPTOR_FILE} describing text, author and local image paths.
 * The descriptor is written last, so its presence means the fetch went through.
 */
public class TweetAssetFetcher implements AssetFetcher {

    private static final Logger logger = LoggerFactory.getLogger(TweetAssetFetcher.class);

    public static final String DESCRIPTOR_FILE = "tweet_api.json";
    static final String PROFILE_IMAGE_FILE = "profile_image.jpg";
    static final String TWEET_IMAGE_FILE = "tweet_image.jpg";

    private static final Pattern STATUS_ID = Pattern.compile("/status/(\\d+)");
    private static final Pattern PROFILE_SIZE_SUFFIX = Pattern.compile("_normal(\\.\\w+)$");
    private static final Pattern LEADING_MENTIONS = Pattern.compile("^(?:@\\w+\\s*)+");
    private static final Pattern SHORT_LINKS = Pattern.compile("https://t\\.co/\\S+");

    private static final String TWEET_QUERY = "expansions=author_id,attachments.media_keys"
            + "&tweet.fields=created_at,text"
            + "&user.fields=name,username,profile_image_url"
            + "&media.fields=url,type";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String bearerToken;
    private final Duration requestTimeout;

    public TweetAssetFetcher(final ContentSettings settings, final ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(settings.requestTimeoutSeconds()))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                settings.apiBaseUrl(),
                settings.bearerToken(),
                Duration.ofSeconds(settings.requestTimeoutSeconds()));
    }

    TweetAssetFetcher(final HttpClient httpClient, final ObjectMapper objectMapper, final String apiBaseUrl,
                      final String bearerToken, final Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.bearerToken = bearerToken;
        this.requestTimeout = requestTimeout;
    }

    /**
     * The tweet id taken from the {@code /status/<digits>} part of the URL.
     */
    @Override
    public Optional<String> deriveIdentifier(final String reference) {
        final Matcher matcher = STATUS_ID.matcher(reference);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    @Override
    public String descriptorFileName() {
        return DESCRIPTOR_FILE;
    }

    @Override
    public void fetch(final String reference, final Path targetDirectory) {
        final Optional<String> tweetId = deriveIdentifier(reference);
        if (tweetId.isEmpty()) {
            logger.error("Cannot fetch {}: no tweet id in reference", reference);
            return;
        }

        try {
            Files.createDirectories(targetDirectory);

            final TweetDescriptor descriptor = toDescriptor(requestTweet(tweetId.get()));
            final String profileImage = downloadImage(descriptor.profileImage(),
                    targetDirectory.resolve(PROFILE_IMAGE_FILE));
            final String tweetImage = downloadImage(descriptor.tweetImage(),
                    targetDirectory.resolve(TWEET_IMAGE_FILE));

            writeDescriptor(descriptor.withImages(profileImage, tweetImage), targetDirectory);
            logger.info("Fetched tweet {} into {}", tweetId.get(), targetDirectory);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while fetching {}", reference);
        } catch (final IOException | RuntimeException e) {
            logger.error("Failed to fetch {} into {}", reference, targetDirectory, e);
        }
    }

    private JsonNode requestTweet(final String tweetId) throws IOException, InterruptedException {
        final HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + "/tweets/" + tweetId + "?" + TWEET_QUERY))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + bearerToken)
                .header("Accept", "application/json")
                .GET()
                .build();

        final HttpResponse<String> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        if (response.statusCode() != 200) {
            throw new IOException("Tweet API returned " + response.statusCode() + " for " + tweetId
                    + ": " + response.body());
        }
        return objectMapper.readTree(response.body());
    }

    /**
     * Reduce an API response to the descriptor fields. Image fields still hold remote URLs.
     */
    TweetDescriptor toDescriptor(final JsonNode response) {
        final JsonNode tweet = response.path("data");
        final JsonNode includes = response.path("includes");
        final JsonNode user = includes.path("users").path(0);

        String imageUrl = "";
        boolean hasVideo = false;
        for (final JsonNode media : includes.path("media")) {
            final String type = media.path("type").asText("");
            if ("photo".equals(type) && imageUrl.isEmpty()) {
                imageUrl = media.path("url").asText("");
            }
            if ("video".equals(type) || "animated_gif".equals(type)) {
                hasVideo = true;
            }
        }

        final String profileImageUrl = user.path("profile_image_url").asText("");
        final String profileImageHd = PROFILE_SIZE_SUFFIX.matcher(profileImageUrl).replaceFirst("_400x400$1");

        String text = tweet.path("text").asText("").strip();
        text = LEADING_MENTIONS.matcher(text).replaceFirst("").strip();
        text = SHORT_LINKS.matcher(text).replaceAll("").strip();

        return new TweetDescriptor(
                text,
                user.path("name").asText(""),
                "@" + user.path("username").asText(""),
                profileImageHd,
                imageUrl,
                hasVideo
        );
    }

    /**
     * Download an image, returning its absolute local path, or an empty string if there is nothing
     * to download or the download failed. A failed image does not fail the tweet.
     */
    private String downloadImage(final String url, final Path target) throws InterruptedException {
        if (url == null || url.isEmpty()) {
            return "";
        }
        try {
            final HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(requestTimeout)
                    .GET()
                    .build();
            final HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                logger.warn("Image download {} returned {}", url, response.statusCode());
                return "";
            }
            Files.write(target, response.body());
            logger.debug("Downloaded {} to {}", url, target);
            return target.toAbsolutePath().toString().replace('\\', '/');
        } catch (final IOException | IllegalArgumentException e) {
            logger.warn("Failed to download image {}", url, e);
            return "";
        }
    }

    private void writeDescriptor(final TweetDescriptor descriptor, final Path targetDirectory) throws IOException {
        final Path target = targetDirectory.resolve(DESCRIPTOR_FILE);
        final Path temp = targetDirectory.resolve(DESCRIPTOR_FILE + ".tmp");
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), descriptor);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
