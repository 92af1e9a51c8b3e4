package org.springaicommunity.release.resolver;

/**
 * What a provider can report about its releases.
 *
 * @param nativePrereleaseFlag the provider flags prereleases itself
 * @param draftFlag the provider distinguishes unpublished or withdrawn releases
 * @param assets releases carry downloadable files
 * @param timestamps releases carry a publish time
 * @param bareNameLookup the provider can look up a project by bare name
 */
public record ProviderCapabilities(boolean nativePrereleaseFlag, boolean draftFlag, boolean assets,
		boolean timestamps, boolean bareNameLookup) {
}
