package ideavalidator.domain.response;

import ideavalidator.domain.exceptions.InvalidResponse;
import ideavalidator.domain.exceptions.MissingResponse;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

@ApplicationScoped
public class OkResponseValidation implements ResponseValidation {
    @Override
    public Response validate(final Response response, final String uri) {
        if (response.getStatus() == 404) {
            throw new MissingResponse("Expected status code 200, but got 404 from URI " + uri
                    + ". This likely indicates the requested model was not found.");
        }

        if (response.getStatus() != 200 && response.getStatus() != 201) {
            final String responseBody = getResponseBody(response);
            throw new InvalidResponse("Expected status code 200, but got "
                    + response.getStatus()
                    + " from URI " + uri + ". " + responseBody,
                    responseBody,
                    response.getStatus());
        }

        return response;
    }

    private String getResponseBody(final Response response) {
        return Try.of(() -> response.readEntity(String.class))
                .getOrElse("No response body available");
    }
}
