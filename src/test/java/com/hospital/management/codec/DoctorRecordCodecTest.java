package com.hospital.management.codec;

import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.Doctor;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.exception.RecordFormatException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DoctorRecordCodecTest {

    private static final String CARDIOLOGY_LINE = "7;Cardiology;Dr. A;123 St;5;09:00;09:30;9;10:00;10:30;\n";

    private final DoctorRecordCodec codec = new DoctorRecordCodec();

    @Test
    public void decodesHeaderAndAppointments() {
        var doctors = codec.decode(CARDIOLOGY_LINE);

        Doctor doctor = doctors.get(7);
        assertNotNull(doctor);
        assertEquals(new DoctorInfo("Cardiology", "Dr. A", "123 St"), doctor.getInfo());
        assertEquals(List.of(new Appointment(5, "09:00", "09:30"), new Appointment(9, "10:00", "10:30")),
                doctor.getAppointments());
    }

    @Test
    public void reEncodingReproducesTheLine() {
        assertEquals(CARDIOLOGY_LINE, codec.encode(codec.decode(CARDIOLOGY_LINE)));
    }

    @Test
    public void entriesStartWithHeaderVariant() {
        var entries = codec.decode(CARDIOLOGY_LINE).get(7).entries();

        assertEquals(3, entries.size());
        assertInstanceOf(DoctorInfo.class, entries.get(0));
        assertInstanceOf(Appointment.class, entries.get(1));
        assertInstanceOf(Appointment.class, entries.get(2));
    }

    @Test
    public void doctorWithoutAppointments() {
        var doctors = codec.decode("1;Surgery;Dr. B;Side Rd;\n2;ER;Dr. C;Back Rd;3;14:00;15:00;\n");

        assertEquals(List.of(1, 2), List.copyOf(doctors.keySet()));
        assertTrue(doctors.get(1).getAppointments().isEmpty());
        assertEquals(1, doctors.get(2).getAppointments().size());
    }

    @Test
    public void doubledSeparatorsAreCollapsedRepeatedly() {
        assertEquals("a;b;c;", DoctorRecordCodec.collapseDoubledSeparators("a;;;;b;;;c;;"));
        assertEquals("a;b", DoctorRecordCodec.collapseDoubledSeparators("a;b"));
    }

    @Test
    public void emptyColumnIsSwallowedByCollapse() {
        // empty department: ";;" becomes ";" and the name moves into the department column
        var doctors = codec.decode("4;;Dr. D;Hill St;Extra;5;13:00;14:00;\n");

        Doctor doctor = doctors.get(4);
        assertEquals(new DoctorInfo("Dr. D", "Hill St", "Extra"), doctor.getInfo());
        assertEquals(List.of(new Appointment(5, "13:00", "14:00")), doctor.getAppointments());
    }

    @Test
    public void unterminatedTripleAtEndOfLineIsDiscarded() {
        var doctors = codec.decode("7;Cardiology;Dr. A;123 St;5;09:00;09:30\n8;ER;Dr. E;Lane;6;13:00;13:30;\n");

        assertTrue(doctors.get(7).getAppointments().isEmpty());
        assertEquals(List.of(new Appointment(6, "13:00", "13:30")), doctors.get(8).getAppointments());
    }

    @Test
    public void newlineBeforeHeaderIsCompleteIsPartOfTheValue() {
        var doctors = codec.decode("7;Cardiology;Dr. A\n;123 St;\n");

        assertEquals("Dr. A\n", doctors.get(7).getInfo().getName());
    }

    @Test
    public void nonIntegerDoctorIdFailsWithFormatError() {
        assertThrows(RecordFormatException.class, () -> codec.decode("D7;Cardiology;Dr. A;123 St;\n"));
    }

    @Test
    public void nonIntegerAppointmentPatientIdFailsWithFormatError() {
        assertThrows(RecordFormatException.class, () -> codec.decode("7;Cardiology;Dr. A;123 St;p5;09:00;09:30;\n"));
    }

    @Test
    public void roundTripsCollections() {
        Map<Integer, Doctor> doctors = new LinkedHashMap<>();
        doctors.put(3, new Doctor(3, new DoctorInfo("Surgery", "Dr. B", "Side Rd"),
                List.of(new Appointment(1, "13:00", "13:30"), new Appointment(42, "16:00", "17:00"))));
        doctors.put(1, new Doctor(1, new DoctorInfo("ER", "Dr. C", "Back Rd")));

        String text = codec.encode(doctors);

        assertEquals("3;Surgery;Dr. B;Side Rd;1;13:00;13:30;42;16:00;17:00;\n1;ER;Dr. C;Back Rd;\n", text);
        assertEquals(doctors, codec.decode(text));
    }
}
