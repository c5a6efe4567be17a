package com.example.drivetransfer.transfer;

import com.example.drivetransfer.destination.DriveClientFactory;
import com.example.drivetransfer.source.ObjectSource;

/**
 * Acquires the authenticated handles a run needs, once per run.
 */
public interface RemoteServices {

    ObjectSource openSource();

    DriveClientFactory openDestination();
}
