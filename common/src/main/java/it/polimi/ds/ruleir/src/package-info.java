@NullMarked
package it.polimi.ds.ruleir.src;

import org.jspecify.annotations.NullMarked;
