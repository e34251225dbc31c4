/**
 * Scheduling value types shared with the card and sync modules.
 */
@NamedInterface("domain")
package app.sage.core.review.domain;

import org.springframework.modulith.NamedInterface;
