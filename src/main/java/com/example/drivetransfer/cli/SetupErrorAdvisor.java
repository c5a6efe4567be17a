package com.example.drivetransfer.cli;

import com.example.drivetransfer.exception.InsufficientScopeException;
import com.example.drivetransfer.exception.MissingCredentialsException;
import com.example.drivetransfer.exception.ProjectNotDeterminedException;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.cloud.storage.StorageException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maps a fatal setup error to user-facing guidance. Errors it does not recognise are left to the caller.
 */
@Component
public class SetupErrorAdvisor {

    static final String LOGIN_COMMAND = "gcloud auth application-default login "
            + "--scopes=https://www.googleapis.com/auth/drive,https://www.googleapis.com/auth/cloud-platform";

    public Optional<SetupFailure> classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof MissingCredentialsException) {
                return Optional.of(missingCredentials(t));
            }
            if (isScopeError(t)) {
                return Optional.of(insufficientScope());
            }
            if (t instanceof ProjectNotDeterminedException || mentionsUndeterminedProject(t)) {
                return Optional.of(projectNotDetermined(t));
            }
        }
        return Optional.empty();
    }

    private static boolean isScopeError(Throwable t) {
        if (t instanceof InsufficientScopeException) {
            return true;
        }
        int status;
        if (t instanceof GoogleJsonResponseException e) {
            status = e.getStatusCode();
        } else if (t instanceof StorageException e) {
            status = e.getCode();
        } else {
            return false;
        }
        return InsufficientScopeException.matches(status, t.getMessage());
    }

    private static boolean mentionsUndeterminedProject(Throwable t) {
        String message = t.getMessage();
        return message != null
                && message.toLowerCase().contains("project")
                && message.toLowerCase().contains("could not be determined");
    }

    private static SetupFailure missingCredentials(Throwable t) {
        return new SetupFailure(SetupFailure.Category.MISSING_CREDENTIALS, List.of(
                "Error: " + t.getMessage(),
                "Please authenticate by running:",
                "  " + LOGIN_COMMAND,
                "Or provide service account files using --gcs-sa and --drive-sa."));
    }

    private static SetupFailure insufficientScope() {
        return new SetupFailure(SetupFailure.Category.INSUFFICIENT_SCOPE, List.of(
                "Error: Insufficient Authentication Scopes.",
                "Your current credentials do not have access to Google Drive.",
                "Please re-authenticate with the required scopes:",
                "  " + LOGIN_COMMAND));
    }

    private static SetupFailure projectNotDetermined(Throwable t) {
        return new SetupFailure(SetupFailure.Category.PROJECT_NOT_DETERMINED, List.of(
                "Error: " + t.getMessage(),
                "It seems the Google Cloud Project ID could not be determined.",
                "Please try running with --project <YOUR_PROJECT_ID>",
                "Or set the quota project via: gcloud auth application-default set-quota-project <PROJECT_ID>"));
    }
}
