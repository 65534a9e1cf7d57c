package io.github.chirino.social.api;

import io.github.chirino.social.api.dto.ProfileDto;
import io.github.chirino.social.service.IdentityLookup;
import io.github.chirino.social.service.SocialOperations;
import io.quarkus.security.Authenticated;
import io.quarkus.security.identity.SecurityIdentity;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Path("/v1/profiles")
@Authenticated
@Produces(MediaType.APPLICATION_JSON)
public class ProfilesResource {

    @Inject IdentityLookup identityLookup;

    @Inject SocialOperations operations;

    @Inject SecurityIdentity identity;

    /** Public profiles for a comma separated list of usernames. */
    @GET
    public List<ProfileDto> lookup(@QueryParam("usernames") String usernames) {
        UUID actor = Ids.actor(identity);
        List<String> names = new ArrayList<>();
        if (usernames != null) {
            for (String name : usernames.split(",")) {
                names.add(name);
            }
        }
        return operations.run(
                "profiles.lookup", actor, null, () -> identityLookup.publicProfiles(names));
    }
}
