/**
 * Watch transport and metrics SPI. The mapping core depends on these types only; concrete
 * transports (Kubernetes, in-memory test doubles) live in their own modules.
 */
package com.authmap.watch.spi;
