package tech.idvault.platform.authentication;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.idvault.platform.shared.MessageResponse;
import tech.idvault.platform.user.Role;

import java.util.Optional;

/**
 * Registration and login endpoints for users and admins.
 * Successful logins return a bearer token to send on protected routes.
 */
@Path("/")
@Tag(name = "Authentication", description = "Registration and login endpoints")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    @Inject
    AuthenticationService authenticationService;

    @Inject
    AccessGate accessGate;

    @POST
    @Path("/register")
    @Operation(summary = "Register a new user")
    @APIResponse(responseCode = "201", description = "User registered")
    @APIResponse(responseCode = "400", description = "Invalid request payload")
    @APIResponse(responseCode = "409", description = "User already exists")
    public Response register(RegisterRequest request) {
        RegisterRequest body = requireBody(request);
        authenticationService.register(body.email(), body.password(), body.role());
        return Response.status(Response.Status.CREATED)
                .entity(new MessageResponse("User registered successfully"))
                .build();
    }

    @POST
    @Path("/login")
    @Operation(summary = "Login with email and password")
    @APIResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = LoginResponse.class)))
    @APIResponse(responseCode = "401", description = "Invalid credentials")
    public LoginResponse login(LoginRequest request) {
        LoginRequest body = requireBody(request);
        return LoginResponse.of(authenticationService.login(body.email(), body.password()));
    }

    /**
     * Create an admin. Requires an admin bearer token once the first admin exists.
     */
    @POST
    @Path("/admin/register")
    @Operation(summary = "Register a new admin user")
    @APIResponse(responseCode = "201", description = "Admin registered")
    @APIResponse(responseCode = "401", description = "Admin session required")
    @APIResponse(responseCode = "403", description = "Admin access required")
    @APIResponse(responseCode = "409", description = "Admin already exists")
    public Response registerAdmin(LoginRequest request,
                                  @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader) {
        LoginRequest body = requireBody(request);
        Optional<AuthenticatedUser> actor = authHeader == null || authHeader.isBlank()
                ? Optional.empty()
                : Optional.of(accessGate.authenticate(authHeader));
        authenticationService.registerAdmin(body.email(), body.password(), actor);
        return Response.status(Response.Status.CREATED)
                .entity(new MessageResponse("Admin registered successfully"))
                .build();
    }

    @POST
    @Path("/admin/login")
    @Operation(summary = "Admin login")
    @APIResponse(responseCode = "200", description = "Login successful",
            content = @Content(schema = @Schema(implementation = LoginResponse.class)))
    @APIResponse(responseCode = "401", description = "Invalid credentials")
    @APIResponse(responseCode = "403", description = "Access denied: Admin only")
    public LoginResponse loginAdmin(LoginRequest request) {
        LoginRequest body = requireBody(request);
        return LoginResponse.of(authenticationService.loginAdmin(body.email(), body.password()));
    }

    private static <T> T requireBody(T body) {
        if (body == null) {
            throw new BadRequestException("Invalid request payload");
        }
        return body;
    }

    // DTOs

    public record RegisterRequest(String email, String password, String role) {}

    public record LoginRequest(String email, String password) {}

    public record LoginResponse(String token, Role role) {
        static LoginResponse of(AuthenticationService.LoginResult result) {
            return new LoginResponse(result.token(), result.role());
        }
    }
}
