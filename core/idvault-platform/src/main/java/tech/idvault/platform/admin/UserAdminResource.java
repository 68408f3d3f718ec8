package tech.idvault.platform.admin;

import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.security.SecurityRequirement;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idvault.platform.authentication.Secured;
import tech.idvault.platform.authentication.SessionContext;
import tech.idvault.platform.shared.MessageResponse;
import tech.idvault.platform.user.UserService;

/**
 * Admin API for user management.
 * All operations require an admin session.
 */
@Path("/admin/users")
@Tag(name = "User Admin", description = "Administrative operations for user management")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@SecurityRequirement(name = "BearerAuth")
@Secured(adminOnly = true)
public class UserAdminResource {

    @Inject
    UserService userService;

    @Inject
    SessionContext sessionContext;

    @GET
    @Operation(summary = "List users", description = "Paginated, newest first")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Page of users",
            content = @Content(schema = @Schema(implementation = UserService.UserPage.class))),
        @APIResponse(responseCode = "401", description = "Not authenticated"),
        @APIResponse(responseCode = "403", description = "Admin access required")
    })
    public UserService.UserPage listUsers(
            @QueryParam("page") @Parameter(description = "Page number, default 1") Integer page,
            @QueryParam("limit") @Parameter(description = "Items per page, default 10, max 100") Integer limit) {
        return userService.listUsers(page, limit);
    }

    @DELETE
    @Path("/{id}")
    @Operation(summary = "Delete a user")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User deleted"),
        @APIResponse(responseCode = "400", description = "Invalid user ID"),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public MessageResponse deleteUser(@PathParam("id") String id) {
        userService.deleteUser(id, sessionContext.requirePrincipal());
        return new MessageResponse("User deleted successfully");
    }

    @PUT
    @Path("/{id}/role")
    @Operation(summary = "Update a user's role")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role updated"),
        @APIResponse(responseCode = "400", description = "Invalid user ID or role"),
        @APIResponse(responseCode = "404", description = "User not found")
    })
    public MessageResponse updateUserRole(@PathParam("id") String id, UpdateRoleRequest request) {
        if (request == null) {
            throw new BadRequestException("Invalid request payload");
        }
        userService.updateUserRole(id, request.role(), sessionContext.requirePrincipal());
        return new MessageResponse("User role updated successfully");
    }

    public record UpdateRoleRequest(String role) {}
}
