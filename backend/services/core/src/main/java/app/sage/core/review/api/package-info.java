@NamedInterface("api")
package app.sage.core.review.api;

import org.springframework.modulith.NamedInterface;
