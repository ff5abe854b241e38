package com.github.salilvnair.funnelengine.spi;

import java.util.Optional;

public interface ResourceDirectory {

    Optional<FunnelResource> findResource(String name, String scope);
}
