package solarplasma.physics.model;

import solarplasma.domain.table.DataTable;
import solarplasma.domain.table.Series;
import solarplasma.physics.units.Constants;
import solarplasma.physics.units.Units;

/**
 * Campo magnético [nT].
 */
public class BField extends Vector {

    public BField(DataTable data) {
        super(data);
    }

    /**
     * Presión magnética en las mismas unidades que la presión térmica.
     * <p>
     * p_B = B² / (2 μ₀)
     */
    public Series pressure() {
        double coeff = Units.B * Units.B / (2.0 * Constants.VACUUM_PERMEABILITY * Units.PTH);
        return magnitude().pow(2).times(coeff).withName("pb");
    }
}
