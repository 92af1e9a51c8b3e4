/**
 * Release resolution engine.
 *
 * <p>
 * Resolves the latest release of a project hosted on GitHub, PyPI, a plain git remote,
 * Wikipedia or an arbitrary download page. Entry point is {@link ReleaseResolver},
 * usually obtained from a {@link ResolverContext} built with
 * {@link ReleaseResolverBuilder}.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.release.resolver;

import org.jspecify.annotations.NullMarked;
