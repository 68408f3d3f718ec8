package tech.idvault.platform.user;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idvault.platform.authentication.Secured;
import tech.idvault.platform.authentication.SessionContext;
import tech.idvault.platform.shared.MessageResponse;

/**
 * Self-service profile endpoints for the authenticated caller.
 */
@Path("/user/profile")
@Tag(name = "User", description = "Profile self-service")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "BearerAuth")
@Secured
public class ProfileResource {

    @Inject
    UserService userService;

    @Inject
    SessionContext sessionContext;

    @GET
    @Operation(summary = "Get the current user's profile")
    @APIResponse(responseCode = "200", description = "Profile",
            content = @Content(schema = @Schema(implementation = UserService.UserView.class)))
    @APIResponse(responseCode = "401", description = "Not authenticated")
    @APIResponse(responseCode = "404", description = "User not found")
    public UserService.UserView getProfile() {
        return userService.getProfile(sessionContext.requirePrincipal());
    }

    @PUT
    @Operation(summary = "Update the current user's email and/or password")
    @APIResponse(responseCode = "200", description = "Profile updated")
    @APIResponse(responseCode = "400", description = "Invalid request payload")
    @APIResponse(responseCode = "409", description = "Email already in use")
    public MessageResponse updateProfile(UpdateProfileRequest request) {
        if (request == null) {
            throw new BadRequestException("Invalid request payload");
        }
        userService.updateProfile(sessionContext.requirePrincipal(), request.email(), request.password());
        return new MessageResponse("Profile updated successfully");
    }

    public record UpdateProfileRequest(String email, String password) {}
}
