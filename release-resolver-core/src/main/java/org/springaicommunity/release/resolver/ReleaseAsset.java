package org.springaicommunity.release.resolver;

/**
 * A downloadable file attached to a release.
 *
 * @param name file name as shown by the provider
 * @param downloadUrl absolute URL to fetch the file
 */
public record ReleaseAsset(String name, String downloadUrl) {
}
