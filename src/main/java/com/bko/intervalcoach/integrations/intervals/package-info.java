@NamedInterface("intervals")
package com.bko.intervalcoach.integrations.intervals;

import org.springframework.modulith.NamedInterface;
