package net.solidcore.container.di.scan.invalid;

import net.solidcore.container.annotation.component.Service;

@Service(Runnable.class)
public class MismatchedService {
}
