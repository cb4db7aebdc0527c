package com.hospital.management.component;

import com.hospital.management.entity.Appointment;
import com.hospital.management.entity.DoctorInfo;
import com.hospital.management.entity.Patient;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class ConsolePhrases {

    private static final String RULE = "-----------------------------------------";

    public String banner() {
        return "****************************************************************************\n"
                + "*                   Welcome Hospital Management System                     *\n"
                + "****************************************************************************";
    }

    public String modeMenu() {
        return RULE + "\n|Enter 1 for Admin mode                 |\n|Enter 2 for user mode                  |\n|Enter Q to quit                        |\n" + RULE;
    }

    public String adminMenu() {
        return RULE + "\n|To manage patients Enter 1             |\n|To manage doctors Enter 2              |\n"
                + "|To manage appointments Enter 3         |\n|To be back Enter B                     |\n" + RULE;
    }

    public String patientMenu() {
        return RULE + "\n|To add new patient Enter 1             |\n|To display patient Enter 2             |\n"
                + "|To delete patient data Enter 3         |\n|To edit patient data Enter 4           |\n"
                + "|To be back Enter B                     |\n" + RULE;
    }

    public String doctorMenu() {
        return RULE + "\n|To add new doctor Enter 1              |\n|To display doctor Enter 2              |\n"
                + "|To delete doctor data Enter 3          |\n|To edit doctor data Enter 4            |\n"
                + "|To be back Enter B                     |\n" + RULE;
    }

    public String appointmentMenu() {
        return RULE + "\n|To book an appointment Enter 1         |\n|To edit an appointment Enter 2         |\n"
                + "|To cancel an appointment Enter 3       |\n|To be back Enter B                     |\n" + RULE;
    }

    public String bookingPatientMenu() {
        return RULE + "\n|For an existing patient Enter 1        |\n|For a new patient Enter 2              |\n"
                + "|To be back Enter B                     |\n" + RULE;
    }

    public String userMenu() {
        return RULE + "\n|To view hospital's departments Enter 1 |\n|To view hospital's doctors Enter 2     |\n"
                + "|To view patients' residents Enter 3    |\n|To view patient's details Enter 4      |\n"
                + "|To view doctor's appointments Enter 5  |\n|To be back Enter B                     |\n" + RULE;
    }

    public String fieldMenu(String what, List<String> labels) {
        StringBuilder sb = new StringBuilder(RULE).append('\n');
        for (int i = 0; i < labels.size(); i++) {
            sb.append("|To edit ").append(what).append(' ').append(labels.get(i))
                    .append(" Enter ").append(i + 1).append('\n');
        }
        return sb.append("|To be back Enter B\n").append(RULE).toString();
    }

    public String currentValue(String label, String value) {
        return "Current " + label + " : " + value;
    }

    public String choicePrompt() {
        return "Enter your choice : ";
    }

    public String invalidChoice() {
        return "Please enter a correct choice";
    }

    public String notAnInteger(String what) {
        return what + " ID should be an integer number";
    }

    public String idUnavailable() {
        return "This ID is unavailable, please try another ID : ";
    }

    public String idIncorrect(String what) {
        return "Incorrect ID, please enter " + what + " ID : ";
    }

    public String done(String what) {
        return "----------------------" + what + " successfully----------------------";
    }

    public String startPrompt() {
        return "Session starts at : ";
    }

    public String endPrompt() {
        return "Session ends at : ";
    }

    public String outsideWorkingHours() {
        return "Appointments should be between 01:00PM to 10:00PM, Please enter a time between working hours : ";
    }

    public String alreadyBooked() {
        return "This appointment is already booked, Please Enter an other time for start of session : ";
    }

    public String noAppointment() {
        return "No Appointment for this patient";
    }

    public String patientDetails(Patient p) {
        return "patient name        : " + p.getName() + "\n"
                + "patient age         : " + p.getAge() + "\n"
                + "patient gender      : " + p.getGender() + "\n"
                + "patient address     : " + p.getAddress() + "\n"
                + "patient room number : " + p.getRoomNumber() + "\n"
                + "patient is in " + p.getDepartment() + " department\n"
                + "patient is followed by doctor : " + p.getAttendingDoctorName();
    }

    public String doctorDetails(DoctorInfo d) {
        return "Doctor name    : " + d.getName() + "\n"
                + "Doctor address : " + d.getAddress() + "\n"
                + "Doctor is in " + d.getDepartment() + " department";
    }

    public String doctorLine(DoctorInfo d) {
        return "\t" + d.getName() + " in " + d.getDepartment() + " department, from " + d.getAddress();
    }

    public String residentLine(Patient p) {
        return "\tPatient : " + p.getName() + " in " + p.getDepartment() + " department and followed by "
                + p.getAttendingDoctorName() + ", age : " + p.getAge() + ", from : " + p.getAddress()
                + ", RoomNumber : " + p.getRoomNumber();
    }

    public String appointmentLine(Appointment a) {
        return "\tfrom : " + a.start() + "    to : " + a.end();
    }
}
