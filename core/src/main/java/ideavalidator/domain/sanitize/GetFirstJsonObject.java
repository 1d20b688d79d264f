package ideavalidator.domain.sanitize;

import io.smallrye.common.annotation.Identifier;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

/**
 * Models often wrap a JSON answer in prose. This returns the text from the first opening brace to the
 * last closing brace, or null if the document holds no such span.
 */
@ApplicationScoped
@Identifier("findFirstJsonObject")
public class GetFirstJsonObject implements SanitizeDocument {

    @Override
    @Nullable
    public String sanitize(@Nullable final String document) {
        if (StringUtils.isBlank(document)) {
            return null;
        }

        final int start = document.indexOf('{');
        final int end = document.lastIndexOf('}');

        if (start < 0 || end <= start) {
            return null;
        }

        return document.substring(start, end + 1);
    }
}
